package com.botical.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A conversation between a user and an agent inside one project.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_ARCHIVED = "archived";
    public static final String STATUS_DELETED = "deleted";

    private String id;
    private String projectId;
    private String title;
    private String agent;
    private String parentId;
    @Builder.Default
    private String status = STATUS_ACTIVE;
    private String providerId;
    private String modelId;
    private long createdAt;
    private long updatedAt;
}
