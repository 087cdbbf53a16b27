package com.unisync.social.common.config;

import com.unisync.social.relationship.service.RelationshipGraphFacade;
import com.unisync.social.relationship.service.RelationshipStateMachine;
import com.unisync.social.relationship.service.StatusResolver;
import com.unisync.social.relationship.store.GuardedRelationshipStore;
import com.unisync.social.relationship.store.JpaRelationshipStore;
import com.unisync.social.relationship.store.RelationshipStore;
import com.unisync.social.relationship.store.UserDirectory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 관계 엔진 구성
 *
 * 엔진 클래스는 스프링에 의존하지 않으므로 여기서 조립한다.
 * 엔진에 주입되는 저장소는 제한 시간이 적용된 GuardedRelationshipStore이다.
 */
@Configuration
@EnableConfigurationProperties(RelationshipEngineProperties.class)
public class RelationshipEngineConfig {

    @Bean
    @Primary
    public RelationshipStore relationshipStore(
            JpaRelationshipStore jpaRelationshipStore,
            @Qualifier("relationshipStoreExecutor") ThreadPoolTaskExecutor storeExecutor,
            RelationshipEngineProperties properties
    ) {
        return new GuardedRelationshipStore(jpaRelationshipStore, storeExecutor, properties.getStoreTimeout());
    }

    @Bean
    public RelationshipStateMachine relationshipStateMachine(RelationshipStore relationshipStore) {
        return new RelationshipStateMachine(relationshipStore);
    }

    @Bean
    public StatusResolver statusResolver(
            RelationshipStore relationshipStore,
            @Qualifier("relationshipLookupExecutor") ThreadPoolTaskExecutor lookupExecutor
    ) {
        return new StatusResolver(relationshipStore, lookupExecutor);
    }

    @Bean
    public RelationshipGraphFacade relationshipGraphFacade(
            RelationshipStore relationshipStore,
            UserDirectory userDirectory,
            RelationshipStateMachine relationshipStateMachine,
            StatusResolver statusResolver,
            @Qualifier("relationshipSearchScheduler") ThreadPoolTaskScheduler searchScheduler,
            @Qualifier("relationshipLookupExecutor") ThreadPoolTaskExecutor lookupExecutor,
            RelationshipEngineProperties properties
    ) {
        return new RelationshipGraphFacade(
                relationshipStore,
                userDirectory,
                relationshipStateMachine,
                statusResolver,
                searchScheduler.getScheduledExecutor(),
                lookupExecutor,
                properties);
    }
}
