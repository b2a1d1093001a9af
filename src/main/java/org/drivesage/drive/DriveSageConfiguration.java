package org.drivesage.drive;

import org.drivesage.drive.analysis.DriveAnalyzer;
import org.drivesage.drive.analysis.DuplicateDetector;
import org.drivesage.drive.analysis.DuplicateVerifier;
import org.drivesage.drive.organize.OperationExecutor;
import org.drivesage.drive.organize.OrganizePlanner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * DriveSage 的 Bean 装配。
 * <p>
 * 分析器与执行器本身不持有配置，分析设置按调用传入；这里只把 {@link DriveSageProperties} 注入到
 * 路径解析、待确认计划存储、整理计划与重复复核中。全部基于本地文件系统，不访问网络。
 */
@Configuration(proxyBeanMethods = false)
public class DriveSageConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(DriveSageProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public PendingOperationStore pendingOperationStore(DriveSageProperties properties) {
        return new PendingOperationStore(properties.getPendingPlanTtl(), properties.getPendingPlanMaxOperations());
    }

    @Bean
    public DuplicateDetector duplicateDetector() {
        return new DuplicateDetector();
    }

    @Bean
    public DriveAnalyzer driveAnalyzer(DuplicateDetector duplicateDetector) {
        return new DriveAnalyzer(duplicateDetector);
    }

    @Bean
    public DuplicateVerifier duplicateVerifier(DriveSageProperties properties) {
        return new DuplicateVerifier(properties.getHashMaxBytes().toBytes());
    }

    @Bean
    public OperationExecutor operationExecutor() {
        return new OperationExecutor();
    }

    @Bean
    public OrganizePlanner organizePlanner(DriveSageProperties properties) {
        return new OrganizePlanner(properties.getOrganizeCategories());
    }
}
