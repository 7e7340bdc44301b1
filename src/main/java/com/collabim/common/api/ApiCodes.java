package com.collabim.common.api;

/**
 * 统一错误码定义。
 *
 * <p>按错误分类划分：4xx00 对应 HTTP 语义，503xx 为存储层暂时不可用（调用方可自行退避重试）。</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 内容校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 已登录但不是会话参与方 / 活动所有者 */
    public static final int FORBIDDEN = 40300;

    /** 引用的实体不存在 */
    public static final int NOT_FOUND = 40400;

    /** 实体状态不满足前置条件（未报名、会话已归档/拉黑、非法状态迁移） */
    public static final int INVALID_STATE = 40900;

    /** 唯一约束冲突（重复会话） */
    public static final int CONFLICT = 40901;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;

    /** 存储层暂时不可用 */
    public static final int UNAVAILABLE = 50300;
}
