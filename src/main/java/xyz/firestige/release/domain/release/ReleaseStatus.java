package xyz.firestige.release.domain.release;

/**
 * 发布状态
 * <p>
 * - DRAFT → PROMOTED: 晋级成功
 * - PROMOTED → ROLLED_BACK: 该版本的部署被回滚
 */
public enum ReleaseStatus {

    DRAFT("草稿"),

    PROMOTED("已晋级"),

    ROLLED_BACK("已回滚");

    private final String description;

    ReleaseStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
