package com.conductor.core.error;

/**
 * A session branch no longer exists locally or on the remote, typically
 * because it was merged and deleted.
 */
public class BranchNotFoundException extends ConductorException {

    public static final String CODE = "BRANCH_NOT_FOUND";

    private final String branch;

    public BranchNotFoundException(String project, String branch) {
        super(CODE, Origin.REQUEST, "Branch '%s' no longer exists in project %s".formatted(branch, project));
        this.branch = branch;
        withContext(null, project, null);
    }

    public String getBranch() {
        return branch;
    }
}
