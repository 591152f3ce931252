package app.sage.core.review.algorithm;

import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.CardState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Picks the cards to study now: unseen cards first in input order, then due cards by due time.
 * Input order is the tie-break, so callers should pass cards in creation order.
 */
@Component
public class DueQueueSelector {

    public static final int DEFAULT_LIMIT = 20;

    public List<CardState> selectDue(List<CardState> states, Instant now, int limit) {
        return selectDue(states, Function.identity(), now, limit);
    }

    public <T> List<T> selectDue(List<T> items,
                                 Function<? super T, CardState> stateOf,
                                 Instant now,
                                 int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }

        List<T> eligible = new ArrayList<>();
        for (T item : items) {
            if (stateOf.apply(item).isDue(now)) {
                eligible.add(item);
            }
        }

        // List.sort is stable
        eligible.sort(queueOrder(stateOf));
        return List.copyOf(eligible.subList(0, Math.min(limit, eligible.size())));
    }

    private static <T> Comparator<T> queueOrder(Function<? super T, CardState> stateOf) {
        return (a, b) -> {
            CardState sa = stateOf.apply(a);
            CardState sb = stateOf.apply(b);
            boolean newA = sa.phase() == CardPhase.NEW;
            boolean newB = sb.phase() == CardPhase.NEW;
            if (newA != newB) return newA ? -1 : 1;
            if (newA) return 0;
            return sa.due().compareTo(sb.due());
        };
    }
}
