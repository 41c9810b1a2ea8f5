package com.rcassist.infrastructure.evidence;

import com.rcassist.domain.analysis.service.EvidenceSource;
import com.rcassist.infrastructure.concurrent.MdcPropagatingExecutor;
import com.rcassist.infrastructure.config.RcaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Slf4j
@Configuration
public class EvidenceConfig {

    @Bean(destroyMethod = "close")
    public MdcPropagatingExecutor evidenceExecutor() {
        return new MdcPropagatingExecutor("evidence");
    }

    @Bean
    public EvidenceCollector evidenceCollector(List<EvidenceSource> sources,
                                               @Qualifier("evidenceExecutor") MdcPropagatingExecutor evidenceExecutor,
                                               RcaProperties properties) {
        log.info("Evidence sources: {}", sources.stream().map(source -> source.kind().key()).toList());
        return new EvidenceCollector(sources, evidenceExecutor, properties.evidence().fetchTimeout());
    }
}
