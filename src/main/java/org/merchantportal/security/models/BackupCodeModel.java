package org.merchantportal.security.models;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "mfa_backup_codes",
        indexes = {
                @Index(name = "idx_mfa_backup_codes_identity_id", columnList = "identity_id")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class BackupCodeModel {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(columnDefinition = "UUID", updatable = false, nullable = false, unique = true)
    private UUID id;

    @Column(name = "identity_id", columnDefinition = "UUID", nullable = false, updatable = false)
    private UUID identityId;

    @Column(name = "code_hash", nullable = false, length = 128)
    private String codeHash;

    @Column(name = "code_salt", nullable = false, length = 64)
    private String codeSalt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
