package com.runframe.starter.configuration;

import com.runframe.core.runtime.SequentialTestRuntime;
import com.runframe.core.spi.DatastoreClientFactory;
import com.runframe.core.spi.TestRuntime;
import com.runframe.starter.config.RunFrameProperties;
import com.runframe.starter.runner.FunctionalTestRunnerFactory;
import com.runframe.starter.runner.RunFrameApplicationRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RunFrame 自动配置
 * <p>
 * 测试运行时可由应用自行声明 {@link TestRuntime} Bean 替换；
 * 声明 {@link DatastoreClientFactory} Bean 后启用数据存储版本校验。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RunFrameProperties.class)
@ConditionalOnProperty(prefix = "runframe", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RunFrameAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TestRuntime testRuntime() {
        return new SequentialTestRuntime();
    }

    @Bean
    @ConditionalOnMissingBean
    public FunctionalTestRunnerFactory functionalTestRunnerFactory(
            RunFrameProperties properties,
            TestRuntime testRuntime,
            ObjectProvider<DatastoreClientFactory> datastoreClientFactoryProvider) {
        DatastoreClientFactory clientFactory = datastoreClientFactoryProvider.getIfAvailable();
        if (clientFactory == null) {
            log.debug("No DatastoreClientFactory bean, datastore version check disabled");
        }
        return new FunctionalTestRunnerFactory(properties, testRuntime, clientFactory);
    }

    @Bean
    @ConditionalOnProperty(prefix = "runframe", name = "auto-run", havingValue = "true")
    public RunFrameApplicationRunner runFrameApplicationRunner(FunctionalTestRunnerFactory runnerFactory,
                                                               RunFrameProperties properties) {
        return new RunFrameApplicationRunner(runnerFactory, properties);
    }
}
