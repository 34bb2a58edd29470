package com.jasmin.threatguard.repositories;

import com.jasmin.threatguard.models.UserBehaviorProfile;

import java.util.Optional;

public interface BehaviorProfileRepository {

    /** Replaces the whole profile of the user. */
    void upsert(UserBehaviorProfile profile);

    Optional<UserBehaviorProfile> findByUserId(String userId);
}
