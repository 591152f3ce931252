package app.sage.core.review.algorithm;

import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.CardState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DueQueueSelectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final DueQueueSelector selector = new DueQueueSelector();

    @Test
    void newCardsComeFirstThenOverdueByDueTime() {
        CardState new1 = CardState.newCard(NOW.minus(Duration.ofDays(3)));
        CardState new2 = CardState.newCard(NOW.minus(Duration.ofDays(2)));
        CardState new3 = CardState.newCard(NOW.minus(Duration.ofDays(1)));
        CardState overdueLong = review(NOW.minus(Duration.ofDays(5)));
        CardState overdueShort = review(NOW.minus(Duration.ofHours(1)));
        CardState notDue = review(NOW.plus(Duration.ofDays(2)));

        List<CardState> queue = selector.selectDue(
                List.of(overdueShort, new1, notDue, new2, overdueLong, new3), NOW, 20);

        assertThat(queue).containsExactly(new1, new2, new3, overdueLong, overdueShort);
    }

    @Test
    void limitCutsTheQueue() {
        List<CardState> input = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            input.add(review(NOW.minus(Duration.ofMinutes(i))));
        }

        List<CardState> queue = selector.selectDue(input, NOW, 5);

        assertThat(queue).hasSize(5);
        assertThat(queue.get(0).due()).isEqualTo(NOW.minus(Duration.ofMinutes(29)));
    }

    @Test
    void cardDueExactlyNowIsIncluded() {
        CardState dueNow = review(NOW);

        assertThat(selector.selectDue(List.of(dueNow), NOW, 1)).containsExactly(dueNow);
    }

    @Test
    void orderIsStableForEqualKeys() {
        Instant due = NOW.minus(Duration.ofHours(2));
        CardState a = new CardState(3.0, 5.0, 0, 3, 1, 0, CardPhase.REVIEW, due, due.minus(Duration.ofDays(3)));
        CardState b = new CardState(4.0, 6.0, 0, 4, 2, 0, CardPhase.REVIEW, due, due.minus(Duration.ofDays(4)));

        assertThat(selector.selectDue(List.of(a, b), NOW, 10)).containsExactly(a, b);
        assertThat(selector.selectDue(List.of(b, a), NOW, 10)).containsExactly(b, a);
    }

    @Test
    void worksOnArbitraryItems() {
        record Item(String id, CardState state) {
        }
        Item late = new Item("late", review(NOW.minus(Duration.ofDays(1))));
        Item fresh = new Item("fresh", CardState.newCard(NOW));

        List<Item> queue = selector.selectDue(List.of(late, fresh), Item::state, NOW, 10);

        assertThat(queue).extracting(Item::id).containsExactly("fresh", "late");
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> selector.selectDue(List.of(), NOW, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static CardState review(Instant due) {
        return new CardState(5.0, 5.0, 0.0, 5.0, 2, 0, CardPhase.REVIEW, due, due.minus(Duration.ofDays(5)));
    }
}
