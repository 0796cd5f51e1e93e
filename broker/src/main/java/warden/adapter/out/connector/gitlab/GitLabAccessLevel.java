package warden.adapter.out.connector.gitlab;

import java.util.Optional;

/**
 * GitLab membership access levels and the role names they are reported as.
 */
public enum GitLabAccessLevel {
    GUEST(10, "guest"),
    REPORTER(20, "reporter"),
    DEVELOPER(30, "developer"),
    MAINTAINER(40, "maintainer"),
    OWNER(50, "owner"),
    ADMIN(60, "admin");

    private final int level;
    private final String role;

    GitLabAccessLevel(int level, String role) {
        this.level = level;
        this.role = role;
    }

    public int level() {
        return level;
    }

    public String role() {
        return role;
    }

    /**
     * @return the access level with exactly this numeric value; other values have no role
     */
    public static Optional<GitLabAccessLevel> fromLevel(int level) {
        for (var value : values()) {
            if (value.level == level) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
