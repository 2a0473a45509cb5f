package xyz.firestige.release.domain.audit;

/**
 * 审计动作与资源类型常量
 */
public final class AuditActions {

    public static final String RELEASE_CREATE = "release.create";
    public static final String RELEASE_PROMOTE = "release.promote";
    public static final String DEPLOYMENT_CREATE = "deployment.create";
    public static final String DEPLOYMENT_SUCCEED = "deployment.succeed";
    public static final String DEPLOYMENT_FAIL = "deployment.fail";
    public static final String DEPLOYMENT_ROLLBACK = "deployment.rollback";
    public static final String DEPLOYMENT_ROLLBACK_FAILED = "deployment.rollback_failed";
    public static final String STAGE_UPDATE = "stage.update";
    public static final String APPROVAL_REQUEST = "approval.request";
    public static final String APPROVAL_DECIDE = "approval.decide";

    public static final String RESOURCE_RELEASE = "release";
    public static final String RESOURCE_DEPLOYMENT = "deployment";
    public static final String RESOURCE_STAGE = "pipeline_stage";
    public static final String RESOURCE_APPROVAL = "approval";
    public static final String RESOURCE_ROLLBACK = "rollback";

    private AuditActions() {
    }
}
