package id.go.kemenkeu.djpbn.sakti.wf.core.statemachine;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.InvalidTransitionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finite set of states plus the table of legal moves between them.
 *
 * <p>Terminal states have no outgoing transitions. A transition to the
 * current state is only legal when the table lists it explicitly.</p>
 */
public final class StateMachine<S extends Enum<S>> {

    private final Class<S> stateType;
    private final Map<S, Set<S>> legal;
    private final Set<S> terminal;
    private final Map<S, List<NamedGuard<S>>> guards;

    private StateMachine(Builder<S> b) {
        this.stateType = b.stateType;
        EnumMap<S, Set<S>> table = new EnumMap<>(b.stateType);
        for (Map.Entry<S, EnumSet<S>> e : b.legal.entrySet()) {
            table.put(e.getKey(), Collections.unmodifiableSet(EnumSet.copyOf(e.getValue())));
        }
        this.legal = Collections.unmodifiableMap(table);
        this.terminal = Collections.unmodifiableSet(EnumSet.copyOf(b.terminal));
        EnumMap<S, List<NamedGuard<S>>> g = new EnumMap<>(b.stateType);
        for (Map.Entry<S, List<NamedGuard<S>>> e : b.guards.entrySet()) {
            g.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }
        this.guards = Collections.unmodifiableMap(g);
    }

    public static <S extends Enum<S>> Builder<S> builder(Class<S> stateType) {
        return new Builder<>(stateType);
    }

    public boolean isLegal(S from, S to) {
        if (from == null || to == null || terminal.contains(from)) {
            return false;
        }
        Set<S> targets = legal.get(from);
        return targets != null && targets.contains(to);
    }

    public boolean isTerminal(S state) {
        return terminal.contains(state);
    }

    public Set<S> allowedTargets(S from) {
        Set<S> targets = legal.get(from);
        return targets != null ? targets : Collections.<S>emptySet();
    }

    /**
     * @throws InvalidTransitionException when the move is not in the table or
     *                                    a guard on {@code to} refuses it
     */
    public void validate(S from, S to, ResourceRow current, Map<String, Object> pendingChanges) {
        if (terminal.contains(from)) {
            throw new InvalidTransitionException(from.name(), to.name(), from.name() + " is terminal");
        }
        if (!isLegal(from, to)) {
            throw new InvalidTransitionException(from.name(), to.name(), "not a legal transition");
        }
        List<NamedGuard<S>> targetGuards = guards.get(to);
        if (targetGuards == null) {
            return;
        }
        for (NamedGuard<S> guard : targetGuards) {
            if (!guard.guard.permits(from, to, current, pendingChanges)) {
                throw new InvalidTransitionException(from.name(), to.name(), guard.reason);
            }
        }
    }

    /**
     * Map a stored status value onto the enum.
     */
    public S parse(String stored) {
        if (stored == null) {
            throw new ValidationException("Status is empty");
        }
        try {
            return Enum.valueOf(stateType, stored.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown " + stateType.getSimpleName() + ": " + stored, e);
        }
    }

    public Class<S> getStateType() {
        return stateType;
    }

    private static final class NamedGuard<S extends Enum<S>> {
        private final String reason;
        private final TransitionGuard<S> guard;

        private NamedGuard(String reason, TransitionGuard<S> guard) {
            this.reason = reason;
            this.guard = guard;
        }
    }

    public static final class Builder<S extends Enum<S>> {
        private final Class<S> stateType;
        private final EnumMap<S, EnumSet<S>> legal;
        private final EnumSet<S> terminal;
        private final EnumMap<S, List<NamedGuard<S>>> guards;

        private Builder(Class<S> stateType) {
            this.stateType = stateType;
            this.legal = new EnumMap<>(stateType);
            this.terminal = EnumSet.noneOf(stateType);
            this.guards = new EnumMap<>(stateType);
        }

        @SafeVarargs
        public final Builder<S> allow(S from, S... targets) {
            EnumSet<S> set = legal.computeIfAbsent(from, k -> EnumSet.noneOf(stateType));
            Collections.addAll(set, targets);
            return this;
        }

        @SafeVarargs
        public final Builder<S> terminal(S... states) {
            Collections.addAll(terminal, states);
            return this;
        }

        public Builder<S> guard(S target, String reason, TransitionGuard<S> guard) {
            guards.computeIfAbsent(target, k -> new ArrayList<>()).add(new NamedGuard<>(reason, guard));
            return this;
        }

        public StateMachine<S> build() {
            for (S t : terminal) {
                EnumSet<S> out = legal.get(t);
                if (out != null && !out.isEmpty()) {
                    throw new IllegalStateException("Terminal state " + t + " has outgoing transitions " + out);
                }
            }
            return new StateMachine<>(this);
        }
    }
}
