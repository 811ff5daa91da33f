package com.smartsense.runtime;

import com.smartsense.api.action.ActionOutcome;
import com.smartsense.api.action.ActionRequest;
import com.smartsense.api.action.ActionResult;
import com.smartsense.api.component.ComponentState;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.api.exception.ConfigurationException;
import com.smartsense.api.security.ActionPermissionPolicy;
import com.smartsense.api.security.PermissionLevel;
import com.smartsense.core.bus.MessageBus;
import com.smartsense.core.component.ActionComponent;
import com.smartsense.core.component.InputComponent;
import com.smartsense.core.component.OutputComponent;
import com.smartsense.core.component.ProcessorComponent;
import com.smartsense.core.config.SmartSenseConfig;
import com.smartsense.runtime.demo.KeywordIntentStrategy;
import com.smartsense.runtime.demo.PlaceholderSystemActions;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SmartSenseRuntime 集成测试")
public class SmartSenseRuntimeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SmartSenseConfig config;
    private SmartSenseRuntime runtime;
    private List<Event> rendered;

    @BeforeEach
    void setUp() {
        config = SmartSenseConfig.defaults();
        config.getLifecycle().setHealthCheckIntervalSeconds(0);
        config.getSecurity().setPermissionLevel(PermissionLevel.MODERATE);
        config.getSecurity().allow(PermissionLevel.SAFE, "window_*");
        rendered = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    // ==================== 辅助方法 ====================

    private InputComponent registerPipeline() {
        runtime = new SmartSenseRuntime(config);
        runtime.register(new OutputComponent("out",
                Set.of(EventType.NLP_RESPONSE, EventType.ACTION_RESULT), rendered::add));
        runtime.register(new ProcessorComponent("nlp", Set.of(EventType.TEXT_INPUT), EventType.NLP_RESPONSE,
                new KeywordIntentStrategy(), Set.of("out"), 1, 10));
        runtime.register(new ActionComponent("actions", new PlaceholderSystemActions(),
                runtime.getPermissionPolicy(), Set.of("out"), 100));
        InputComponent input = new InputComponent("in", EventType.TEXT_INPUT, Set.of("nlp", "actions"));
        runtime.register(input);
        return input;
    }

    // ==================== 端到端 ====================

    @Nested
    @DisplayName("端到端")
    class EndToEndTests {

        @Test
        @DisplayName("文本输入经处理器到达输出")
        void textShouldFlowToOutput() {
            InputComponent input = registerPipeline();
            runtime.start();

            assertEquals(1, input.submit(Map.of("text", "hello there")));

            await().atMost(TIMEOUT).until(() -> rendered.size() == 1);
            Event response = rendered.get(0);
            assertEquals(EventType.NLP_RESPONSE, response.type());
            assertEquals("greeting", response.getString("intent").orElseThrow());
            assertEquals("nlp", response.sourceComponentId());
        }

        @Test
        @DisplayName("动作请求经权限检查后返回结果")
        void actionShouldBeCheckedAndExecuted() {
            InputComponent input = registerPipeline();
            runtime.start();

            input.submit(EventType.EXECUTE_ACTION,
                    new ActionRequest("window_list", Map.of(), PermissionLevel.SAFE).toPayload());
            input.submit(EventType.EXECUTE_ACTION,
                    new ActionRequest("keyboard_type", Map.of(), PermissionLevel.SAFE).toPayload());

            await().atMost(TIMEOUT).until(() -> rendered.size() == 2);
            ActionResult allowed = ActionResult.fromEvent(rendered.get(0));
            ActionResult denied = ActionResult.fromEvent(rendered.get(1));
            assertEquals(ActionOutcome.SUCCESS, allowed.outcome());
            assertEquals("window", allowed.resultData().get("category"));
            assertEquals(ActionOutcome.PERMISSION_DENIED, denied.outcome());
        }

        @Test
        @DisplayName("组件按依赖顺序启动，按逆序停止")
        void componentsShouldFollowDependencyOrder() {
            registerPipeline();
            runtime.start();

            assertEquals(List.of("out", "nlp", "actions", "in"), runtime.getLifecycleManager().getStartOrder());

            runtime.close();

            runtime.getLifecycleManager().getStatus()
                    .forEach(s -> assertEquals(ComponentState.STOPPED, s.state()));
            assertFalse(runtime.getMessageBus().isAccepting());
        }
    }

    // ==================== 配置 ====================

    @Nested
    @DisplayName("配置")
    class ConfigurationTests {

        @Test
        @DisplayName("被禁用的组件不注册")
        void disabledComponentShouldBeSkipped() {
            SmartSenseConfig.ComponentSettings disabled = new SmartSenseConfig.ComponentSettings();
            disabled.setEnabled(false);
            config.getComponents().put("extra", disabled);
            runtime = new SmartSenseRuntime(config);

            runtime.register(new InputComponent("extra", EventType.TEXT_INPUT));
            runtime.start();

            assertEquals(Set.of("extra"), runtime.getDisabledComponents());
            assertTrue(runtime.getLifecycleManager().getState("extra").isEmpty());
        }

        @Test
        @DisplayName("依赖被禁用的组件时启动失败")
        void dependencyOnDisabledComponentShouldFail() {
            SmartSenseConfig.ComponentSettings disabled = new SmartSenseConfig.ComponentSettings();
            disabled.setEnabled(false);
            config.getComponents().put("nlp", disabled);
            registerPipeline();

            ConfigurationException e = assertThrows(ConfigurationException.class, () -> runtime.start());

            assertTrue(e.getMessage().contains("disabled"), e.getMessage());
            assertEquals(ComponentState.REGISTERED, runtime.getLifecycleManager().getState("in").orElseThrow());
        }

        @Test
        @DisplayName("非法配置在构造时被拒绝")
        void invalidConfigShouldBeRejected() {
            config.getBus().setQueueCapacity(0);

            assertThrows(ConfigurationException.class, () -> new SmartSenseRuntime(config));
        }
    }

    // ==================== 服务与关闭 ====================

    @Nested
    @DisplayName("服务与关闭")
    class ServiceTests {

        @Test
        @DisplayName("核心服务在定位器中可查")
        void coreServicesShouldBeRegistered() {
            runtime = new SmartSenseRuntime(config);

            assertSame(runtime.getMessageBus(), runtime.getServiceLocator().getRequired(MessageBus.class));
            assertSame(runtime.getPermissionPolicy(),
                    runtime.getServiceLocator().getRequired(ActionPermissionPolicy.class));
            assertSame(config, runtime.getServiceLocator().getRequired(SmartSenseConfig.class));
        }

        @Test
        @DisplayName("启动后定位器被封存")
        void locatorShouldBeSealedAfterStart() {
            runtime = new SmartSenseRuntime(config);
            runtime.registerService(StringBuilder.class, new StringBuilder("shared"));
            runtime.start();

            assertTrue(runtime.getServiceLocator().isSealed());
            assertThrows(ConfigurationException.class,
                    () -> runtime.registerService(Integer.class, 1));
        }

        @Test
        @DisplayName("重复关闭无副作用，关闭后不能启动")
        void closeShouldBeIdempotent() {
            registerPipeline();
            runtime.start();

            runtime.close();
            assertDoesNotThrow(() -> runtime.close());

            assertTrue(runtime.isClosed());
            assertThrows(IllegalStateException.class, () -> runtime.start());
        }
    }
}
