package com.collabim.domain.service;

import com.collabim.common.error.ChatException;
import com.collabim.domain.config.RecruitmentProperties;
import com.collabim.domain.enums.RecruitmentStatus;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 招募状态迁移规则。
 *
 * <p>strict 模式下允许的迁移：</p>
 * <ul>
 *   <li>discussing -> offer_sent</li>
 *   <li>offer_sent -> accepted / declined / discussing</li>
 *   <li>accepted -> completed</li>
 *   <li>declined -> discussing</li>
 * </ul>
 * <p>permissive 模式不做限制。两种模式下“改成当前值”都视为无变化。</p>
 */
@Component
public class RecruitmentTransitionPolicy {

    private static final Map<RecruitmentStatus, Set<RecruitmentStatus>> STRICT = new EnumMap<>(RecruitmentStatus.class);

    static {
        STRICT.put(RecruitmentStatus.DISCUSSING, EnumSet.of(RecruitmentStatus.OFFER_SENT));
        STRICT.put(RecruitmentStatus.OFFER_SENT,
                EnumSet.of(RecruitmentStatus.ACCEPTED, RecruitmentStatus.DECLINED, RecruitmentStatus.DISCUSSING));
        STRICT.put(RecruitmentStatus.ACCEPTED, EnumSet.of(RecruitmentStatus.COMPLETED));
        STRICT.put(RecruitmentStatus.DECLINED, EnumSet.of(RecruitmentStatus.DISCUSSING));
        STRICT.put(RecruitmentStatus.COMPLETED, EnumSet.noneOf(RecruitmentStatus.class));
    }

    private final RecruitmentProperties props;

    public RecruitmentTransitionPolicy(RecruitmentProperties props) {
        this.props = props;
    }

    public boolean isStrict() {
        return props.isStrict();
    }

    public boolean isAllowed(RecruitmentStatus from, RecruitmentStatus to) {
        if (to == null || from == to || !props.isStrict()) {
            return true;
        }
        // 历史数据可能为空，按初始状态处理
        RecruitmentStatus cur = from == null ? RecruitmentStatus.DISCUSSING : from;
        return cur == to || STRICT.getOrDefault(cur, Set.of()).contains(to);
    }

    public void check(RecruitmentStatus from, RecruitmentStatus to) {
        if (!isAllowed(from, to)) {
            throw ChatException.invalidState("illegal_transition");
        }
    }
}
