package com.example.starterkit.projectgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LicenseRef {
    private String id;
    private String licenseKey;
    private String downloadToken;
    private int downloadCount;
    private int maxDownloads;
    private String status;

    /**
     * Null for lifetime licenses
     */
    private Instant expiresAt;
}
