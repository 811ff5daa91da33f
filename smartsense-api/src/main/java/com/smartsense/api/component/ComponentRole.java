package com.smartsense.api.component;

/**
 * 组件角色标记
 */
public enum ComponentRole {
    /**
     * 从外部来源（文本、麦克风、截图）产生事件
     */
    INPUT,
    /**
     * 订阅输入事件，执行推理并发布结果
     */
    PROCESSOR,
    /**
     * 纯输出端，把结果渲染到外部
     */
    OUTPUT,
    /**
     * 执行有副作用的操作（受权限策略约束）
     */
    ACTION
}
