package com.botical.gateway;

import com.botical.common.bus.EventBus;
import com.botical.common.store.InMemoryWorkspaceStore;
import com.botical.common.store.WorkspaceStore;
import com.botical.gateway.approval.ApprovalDecisionCache;
import com.botical.gateway.approval.ApprovalTable;
import com.botical.gateway.approval.ToolApprovalCoordinator;
import com.botical.gateway.auth.ConnectionAuthenticator;
import com.botical.gateway.runtime.GatewaySettings;
import com.botical.gateway.sync.StateCatchUpService;
import com.botical.gateway.websocket.ConnectionRegistry;
import com.botical.gateway.websocket.RequestRouter;
import com.botical.gateway.websocket.RoomIndex;
import com.botical.gateway.websocket.SyncBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Spring configuration for gateway beans. Every component is constructed
 * here; nothing in the gateway holds static state.
 */
@Slf4j
@Configuration
public class GatewayBeanConfig {

    @Value("${botical.gateway.path:/ws}")
    private String path;
    @Value("${botical.gateway.single-user:true}")
    private boolean singleUser;
    @Value("${botical.gateway.auth-tokens:}")
    private String authTokens;
    @Value("${botical.gateway.project-access:}")
    private String projectAccess;
    @Value("${botical.gateway.approval-timeout:5m}")
    private Duration approvalTimeout;
    @Value("${botical.gateway.decision-cache-ttl:8h}")
    private Duration decisionCacheTtl;
    @Value("${botical.gateway.send-time-limit:10s}")
    private Duration sendTimeLimit;
    @Value("${botical.gateway.send-buffer-limit:512KB}")
    private DataSize sendBufferLimit;

    @Bean
    public GatewaySettings gatewaySettings() {
        GatewaySettings settings = GatewaySettings.builder()
                .path(path)
                .singleUser(singleUser)
                .authTokens(GatewaySettings.parseTokens(authTokens))
                .projectAccess(GatewaySettings.parseProjectAccess(projectAccess))
                .approvalTimeout(approvalTimeout)
                .decisionCacheTtl(decisionCacheTtl)
                .sendTimeLimitMs(Math.toIntExact(sendTimeLimit.toMillis()))
                .sendBufferLimit(Math.toIntExact(sendBufferLimit.toBytes()))
                .build();
        log.info("gateway:settings path={} singleUser={} tokens={} accessUsers={} approvalTimeout={}",
                settings.getPath(), settings.isSingleUser(), settings.getAuthTokens().size(),
                settings.getProjectAccess().size(), settings.getApprovalTimeout());
        return settings;
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public WorkspaceStore workspaceStore() {
        return new InMemoryWorkspaceStore();
    }

    @Bean
    public RoomIndex roomIndex() {
        return new RoomIndex();
    }

    @Bean
    public ConnectionRegistry connectionRegistry(RoomIndex roomIndex) {
        return new ConnectionRegistry(roomIndex);
    }

    @Bean(initMethod = "setup", destroyMethod = "teardown")
    public SyncBridge syncBridge(EventBus eventBus, RoomIndex roomIndex,
            ConnectionRegistry connectionRegistry, ObjectMapper objectMapper) {
        return new SyncBridge(eventBus, roomIndex, connectionRegistry, objectMapper);
    }

    @Bean
    public StateCatchUpService stateCatchUpService(WorkspaceStore workspaceStore,
            ConnectionRegistry connectionRegistry, ObjectMapper objectMapper) {
        return new StateCatchUpService(workspaceStore, connectionRegistry, objectMapper);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService approvalScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "approval-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "close")
    public ApprovalTable approvalTable(ScheduledExecutorService approvalScheduler, GatewaySettings settings) {
        return new ApprovalTable(approvalScheduler, settings.getApprovalTimeout());
    }

    @Bean
    public ApprovalDecisionCache approvalDecisionCache(GatewaySettings settings) {
        return new ApprovalDecisionCache(settings.getDecisionCacheTtl());
    }

    @Bean
    public ToolApprovalCoordinator toolApprovalCoordinator(ApprovalTable approvalTable,
            ApprovalDecisionCache approvalDecisionCache, EventBus eventBus, WorkspaceStore workspaceStore) {
        return new ToolApprovalCoordinator(approvalTable, approvalDecisionCache, eventBus, workspaceStore);
    }

    @Bean
    public ConnectionAuthenticator connectionAuthenticator(GatewaySettings settings) {
        return new ConnectionAuthenticator(settings);
    }

    @Bean
    public RequestRouter requestRouter() {
        return new RequestRouter();
    }
}
