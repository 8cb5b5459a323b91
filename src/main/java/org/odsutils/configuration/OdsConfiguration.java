package org.odsutils.configuration;

import org.odsutils.adapters.HorizonCheck;
import org.odsutils.adapters.SiderealHorizonCheck;
import org.odsutils.models.standard.Standard;
import org.odsutils.service.standard.StandardLoader;
import org.odsutils.utils.DateInterpreter;
import org.odsutils.utils.DefaultDateInterpreter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OdsConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Standard standard(StandardLoader standardLoader,
                             @Value("${ods.standard.version:latest}") String version) {
        return standardLoader.load(version);
    }

    @Bean
    public DateInterpreter dateInterpreter(Clock clock) {
        return new DefaultDateInterpreter(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public HorizonCheck horizonCheck() {
        return new SiderealHorizonCheck();
    }
}
