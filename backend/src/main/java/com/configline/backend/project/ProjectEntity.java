package com.configline.backend.project;

import jakarta.persistence.*;

@Entity
@Table(name = "projects")
public class ProjectEntity {

    @Id
    @Column(nullable = false, length = 64)
    private String id;

    @Column(nullable = false, length = 180)
    private String name;

    @Column(name = "require_proposals", nullable = false)
    private boolean requireProposals;

    @Column(name = "allow_self_approvals", nullable = false)
    private boolean allowSelfApprovals;

    protected ProjectEntity() {}

    public ProjectEntity(String id, String name, boolean requireProposals, boolean allowSelfApprovals) {
        this.id = id;
        this.name = name;
        this.requireProposals = requireProposals;
        this.allowSelfApprovals = allowSelfApprovals;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public boolean isRequireProposals() { return requireProposals; }
    public boolean isAllowSelfApprovals() { return allowSelfApprovals; }

    public void setRequireProposals(boolean requireProposals) { this.requireProposals = requireProposals; }
    public void setAllowSelfApprovals(boolean allowSelfApprovals) { this.allowSelfApprovals = allowSelfApprovals; }
}
