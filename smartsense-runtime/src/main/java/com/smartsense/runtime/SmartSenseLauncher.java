package com.smartsense.runtime;

import com.smartsense.api.event.EventType;
import com.smartsense.api.exception.ConfigurationException;
import com.smartsense.api.exception.InitializationException;
import com.smartsense.core.component.ActionComponent;
import com.smartsense.core.component.OutputComponent;
import com.smartsense.core.component.ProcessorComponent;
import com.smartsense.core.config.SmartSenseConfig;
import com.smartsense.core.config.SmartSenseConfigLoader;
import com.smartsense.runtime.demo.ConsoleOutputRenderer;
import com.smartsense.runtime.demo.ConsoleTextInput;
import com.smartsense.runtime.demo.KeywordIntentStrategy;
import com.smartsense.runtime.demo.PlaceholderSystemActions;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

/**
 * 演示入口
 * 控制台输入 → 关键词意图处理器 → 控制台输出，另带一个占位的系统控制动作组件
 * <p>
 * 用法：SmartSenseLauncher [配置文件路径]
 */
@Slf4j
public class SmartSenseLauncher {

    public static final String TEXT_INPUT = "text-input";
    public static final String NLP_PROCESSOR = "nlp-processor";
    public static final String TEXT_OUTPUT = "text-output";
    public static final String SYSTEM_CONTROL = "system-control";

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            exitCode = 2;
        } catch (InitializationException e) {
            e.getFailures().forEach(f -> log.error("[{}] {}", f.componentId(), f.reason()));
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    static int run(String[] args) {
        SmartSenseConfig config = args.length > 0
                ? SmartSenseConfigLoader.load(Path.of(args[0]))
                : SmartSenseConfigLoader.loadFromClasspath(SmartSenseConfigLoader.DEFAULT_RESOURCE);

        CountDownLatch quit = new CountDownLatch(1);
        try (SmartSenseRuntime runtime = new SmartSenseRuntime(config)) {
            runtime.registerShutdownHook();
            registerDemoComponents(runtime, quit::countDown);
            runtime.start();

            System.out.println("SmartSense ready. Type a message, /action <command> [level], or quit.");
            quit.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }

    /**
     * 注册演示组件
     * 依赖关系保证下游先于上游启动：输出 → 处理器 → 输入
     */
    static void registerDemoComponents(SmartSenseRuntime runtime, Runnable onQuit) {
        runtime.register(new OutputComponent(TEXT_OUTPUT,
                Set.of(EventType.NLP_RESPONSE, EventType.DISPLAY_TEXT, EventType.ACTION_RESULT, EventType.ERROR),
                new ConsoleOutputRenderer(System.out)));

        runtime.register(new ProcessorComponent(NLP_PROCESSOR,
                Set.of(EventType.TEXT_INPUT, EventType.VOICE_INPUT),
                EventType.NLP_RESPONSE,
                new KeywordIntentStrategy(),
                Set.of(TEXT_OUTPUT), 1, 100));

        runtime.register(new ActionComponent(SYSTEM_CONTROL,
                new PlaceholderSystemActions(),
                runtime.getPermissionPolicy(),
                Set.of(TEXT_OUTPUT), 1000));

        runtime.register(new ConsoleTextInput(TEXT_INPUT, System.in, onQuit,
                Set.of(NLP_PROCESSOR, SYSTEM_CONTROL)));
    }
}
