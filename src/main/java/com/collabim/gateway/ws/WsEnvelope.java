package com.collabim.gateway.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * WS 文本帧的统一外壳。入站事件把参数平铺在外壳上，出站事件把载荷放在 data 里。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WsEnvelope {

    /**
     * 事件名（路由字段），小写 snake_case。
     *
     * <p>示例：join_chat / typing_start / new_message / error ...</p>
     */
    public String type;

    /** 会话 id（join_chat / leave_chat / typing_* / message_read）。 */
    public Long conversationId;

    /** 消息 id（message_read）。 */
    public Long messageId;

    /** update_status 的状态文案。 */
    public String status;

    /** 出站事件载荷。 */
    public Object data;

    /** 失败原因（type=error）。 */
    public String reason;

    /** 服务端时间戳（毫秒）。 */
    public Long ts;
}
