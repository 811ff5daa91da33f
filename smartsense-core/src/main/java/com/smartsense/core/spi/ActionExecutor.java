package com.smartsense.core.spi;

import com.smartsense.api.action.ActionRequest;

import java.util.Map;

/**
 * 系统动作执行器
 * 只会收到已通过权限检查的请求
 */
public interface ActionExecutor {

    /**
     * 是否支持该命令
     */
    boolean supports(String command);

    /**
     * 执行动作
     *
     * @return 结果数据
     * @throws Exception 执行失败
     */
    Map<String, Object> execute(ActionRequest request) throws Exception;
}
