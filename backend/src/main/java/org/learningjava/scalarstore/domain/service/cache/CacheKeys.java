package org.learningjava.scalarstore.domain.service.cache;

/**
 * Cache key layout:
 * {@code scalars_cache:<project>:<exp=<experiment>|project>:max_points=<n>:return_tags=<0|1>}.
 * <p>
 * Experiment scopes always carry the {@code exp=} prefix, so no experiment id can address the
 * whole-project entry. Ids embedded in patterns are glob-escaped.
 */
public final class CacheKeys {

    public static final String PREFIX = "scalars_cache";
    public static final String WHOLE_PROJECT = "project";
    static final String EXPERIMENT_SCOPE = "exp=";

    private CacheKeys() {
    }

    public static String experiment(String projectId, String experimentId, int maxPoints, boolean returnTags) {
        return key(projectId, EXPERIMENT_SCOPE + experimentId, maxPoints, returnTags);
    }

    public static String wholeProject(String projectId, int maxPoints, boolean returnTags) {
        return key(projectId, WHOLE_PROJECT, maxPoints, returnTags);
    }

    /** Every variant cached for one experiment. */
    public static String experimentPattern(String projectId, String experimentId) {
        return scopePattern(projectId, EXPERIMENT_SCOPE + experimentId);
    }

    /** Every variant of the whole-project aggregate. */
    public static String wholeProjectPattern(String projectId) {
        return scopePattern(projectId, WHOLE_PROJECT);
    }

    /** Everything cached for a project. */
    public static String projectPattern(String projectId) {
        return PREFIX + ":" + GlobPattern.escape(projectId) + ":*";
    }

    private static String scopePattern(String projectId, String scope) {
        return PREFIX + ":" + GlobPattern.escape(projectId) + ":" + GlobPattern.escape(scope) + ":max_points=*";
    }

    private static String key(String projectId, String scope, int maxPoints, boolean returnTags) {
        return PREFIX + ":" + projectId + ":" + scope
                + ":max_points=" + maxPoints
                + ":return_tags=" + (returnTags ? 1 : 0);
    }
}
