package xyz.firestige.release.domain.state;

import xyz.firestige.release.domain.shared.exception.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 状态迁移规则表（每个实体一张）
 * <p>
 * 所有实体的状态写入都经过 {@link #check}，不在调用点零散判断。
 * 未登记的 from 状态视为终态。
 *
 * @param <S> 状态枚举
 */
public final class TransitionRules<S extends Enum<S>> {

    private final String entity;
    private final Map<S, Set<S>> rules;

    private TransitionRules(String entity, Map<S, Set<S>> rules) {
        this.entity = entity;
        this.rules = rules;
    }

    public static <S extends Enum<S>> Builder<S> builder(String entity, Class<S> type) {
        return new Builder<>(entity, type);
    }

    public boolean isAllowed(S from, S to) {
        return rules.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    public Set<S> allowedTargets(S from) {
        return Collections.unmodifiableSet(rules.getOrDefault(from, Collections.emptySet()));
    }

    public boolean isTerminal(S status) {
        return allowedTargets(status).isEmpty();
    }

    /**
     * 校验迁移，非法时抛出 {@link InvalidTransitionException}
     */
    public void check(String entityId, S from, S to) {
        if (!isAllowed(from, to)) {
            throw new InvalidTransitionException(entity, entityId, from, to);
        }
    }

    public String getEntity() {
        return entity;
    }

    public static final class Builder<S extends Enum<S>> {
        private final String entity;
        private final Class<S> type;
        private final Map<S, Set<S>> rules;

        private Builder(String entity, Class<S> type) {
            this.entity = entity;
            this.type = type;
            this.rules = new EnumMap<>(type);
        }

        @SafeVarargs
        public final Builder<S> allow(S from, S... targets) {
            Set<S> set = rules.computeIfAbsent(from, k -> EnumSet.noneOf(type));
            Collections.addAll(set, targets);
            return this;
        }

        public TransitionRules<S> build() {
            Map<S, Set<S>> copy = new EnumMap<>(type);
            rules.forEach((k, v) -> copy.put(k, EnumSet.copyOf(v)));
            return new TransitionRules<>(entity, copy);
        }
    }
}
