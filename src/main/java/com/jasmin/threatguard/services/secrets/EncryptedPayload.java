package com.jasmin.threatguard.services.secrets;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** AES-GCM output, every field hex encoded. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class EncryptedPayload {
    private String ciphertext;
    private String iv;
    private String authTag;
}
