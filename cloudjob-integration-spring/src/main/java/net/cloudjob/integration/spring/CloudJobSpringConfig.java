package net.cloudjob.integration.spring;

import net.cloudjob.core.spi.Clock;
import net.cloudjob.core.spi.CronCalculator;
import net.cloudjob.integration.spring.cron.CronUtilsCalculator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** 저장소와 무관한 SPI 기본 구현 */
@Configuration(proxyBeanMethods = false)
public class CloudJobSpringConfig {

    @Bean
    public Clock systemClock() { return Clock.system(); }

    @Bean
    public CronCalculator cronCalculator() { return new CronUtilsCalculator(); }
}
