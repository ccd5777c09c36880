package com.configline.backend.configs;

import com.configline.backend.permission.ConfigMemberRole;
import jakarta.persistence.*;

import java.util.UUID;

@Entity
@Table(name = "config_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_config_members_email", columnNames = {"config_id", "email"}))
public class ConfigMemberEntity {

    @Id
    @Column(nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "config_id", nullable = false)
    private ConfigEntity config;

    @Column(nullable = false, length = 320)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ConfigMemberRole role;

    protected ConfigMemberEntity() {}

    public ConfigMemberEntity(ConfigEntity config, String email, ConfigMemberRole role) {
        this.id = UUID.randomUUID();
        this.config = config;
        this.email = email;
        this.role = role;
    }

    public UUID getId() { return id; }
    public ConfigEntity getConfig() { return config; }
    public String getEmail() { return email; }
    public ConfigMemberRole getRole() { return role; }
}
