package com.smartsense.core.diagnostic;

import lombok.extern.slf4j.Slf4j;

/**
 * 审计日志出口
 * 把诊断事件以 key=value 形式写入 smartsense.audit 日志，方便日志系统采集
 */
@Slf4j(topic = "smartsense.audit")
public class AuditLogListener {

    private final boolean auditAllowedActions;

    public AuditLogListener(boolean auditAllowedActions) {
        this.auditAllowedActions = auditAllowedActions;
    }

    /**
     * 挂载到诊断总线
     */
    public DiagnosticBus.Subscription attach(DiagnosticBus diagnosticBus) {
        return diagnosticBus.subscribe(DiagnosticEvent.class, this::record);
    }

    void record(DiagnosticEvent event) {
        if (event instanceof DiagnosticEvent.ComponentStateChanged e) {
            log.info("[AUDIT] type=state component={} from={} to={} reason={}",
                    e.componentId(), e.from(), e.to(), e.reason());
        } else if (event instanceof DiagnosticEvent.EventDropped e) {
            log.warn("[AUDIT] type=drop subscriber={} event={} eventType={} reason={}",
                    e.componentId(), e.event().eventId(), e.event().type(), e.reason());
        } else if (event instanceof DiagnosticEvent.HandlerFailed e) {
            log.warn("[AUDIT] type=handler-failure subscriber={} event={} eventType={} consecutive={} error={}",
                    e.componentId(), e.event().eventId(), e.event().type(), e.consecutiveFailures(),
                    e.error().toString());
        } else if (event instanceof DiagnosticEvent.HandlerTimeout e) {
            log.warn("[AUDIT] type=handler-timeout subscriber={} event={} eventType={} elapsedMs={} timeoutMs={}",
                    e.componentId(), e.event().eventId(), e.event().type(), e.elapsedMs(), e.timeoutMs());
        } else if (event instanceof DiagnosticEvent.LifecycleTimeout e) {
            log.warn("[AUDIT] type=timeout component={} phase={} timeoutMs={}",
                    e.componentId(), e.phase(), e.timeoutMs());
        } else if (event instanceof DiagnosticEvent.PermissionDecision e) {
            if (!e.allowed()) {
                log.warn("[AUDIT] type=permission component={} command={} level={} allowed=false reason={}",
                        e.componentId(), e.command(), e.level(), e.reason());
            } else if (auditAllowedActions) {
                log.info("[AUDIT] type=permission component={} command={} level={} allowed=true",
                        e.componentId(), e.command(), e.level());
            }
        }
    }
}
