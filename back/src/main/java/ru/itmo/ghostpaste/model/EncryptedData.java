package ru.itmo.ghostpaste.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client-encrypted user metadata. Both fields are Base64 and never inspected server side.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EncryptedData {
    private String iv;
    private String data;

    public static EncryptedData empty() {
        return new EncryptedData("", "");
    }
}
