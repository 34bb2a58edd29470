package com.jasmin.threatguard.detectors.ddos;

import com.jasmin.threatguard.store.KeyManager;
import com.jasmin.threatguard.store.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Open-connection gauge per IP, read by the slow-connection heuristic.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectionTracker {

    private final StateStore store;
    private final DdosProperties props;

    public void opened(String ip) {
        String key = KeyManager.slowConnections(ip);
        store.increment(key);
        store.expire(key, Duration.ofSeconds(props.getSlowConnectionTtlSeconds()));
    }

    public void closed(String ip) {
        try {
            if (store.decrement(KeyManager.slowConnections(ip)) <= 0) {
                store.delete(KeyManager.slowConnections(ip));
            }
        } catch (Exception e) {
            log.error("Failed to release connection slot: ip={}", ip, e);
        }
    }
}
