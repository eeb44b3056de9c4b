package com.yerin.flowq.migration;

/**
 * @param totalJobs     큐에서 조회한 작업 수
 * @param migratedJobs  한 단계 이상 버전이 올라간 작업 수
 * @param appliedSteps  적용된 단계 수 합계
 * @param failedJobs    예외로 건너뛴 작업 수
 * @param skipped       락을 얻지 못해 패스 전체를 건너뛰었는지
 */
public record MigrationReport(int totalJobs, int migratedJobs, int appliedSteps, int failedJobs, boolean skipped) {

    public static MigrationReport lockNotAcquired() {
        return new MigrationReport(0, 0, 0, 0, true);
    }
}
