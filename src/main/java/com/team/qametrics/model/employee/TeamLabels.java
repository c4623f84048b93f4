package com.team.qametrics.model.employee;

/**
 * 對外呈現的團隊標籤。
 */
public final class TeamLabels {

    public static final String DEV = "DEV";
    public static final String QA = "QA";
    /** 不在員工主檔中的參與者一律歸為客戶端 BIS 團隊 */
    public static final String BIS_TEAM = "BIS Team";
    public static final String UNKNOWN = "Unknown";

    /** 規劃比較頁的團隊篩選：不篩選 */
    public static final String ALL = "ALL";

    private TeamLabels() {
    }
}
