package com.alphix.liquidity.service;

import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.InputSide;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.service.CompletionTracker.Progress;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionTrackerTest {

    private static final TokenRef A = new TokenRef("A", "0x000000000000000000000000000000000000000a", 18, 4);
    private static final TokenRef B = new TokenRef("B", "0x000000000000000000000000000000000000000b", 6, 2);

    private final CompletionTracker tracker = new CompletionTracker();

    @Test
    void testCountsFollowLedger() {
        DepositIntent intent = intent("1", "2");
        CompletionLedger ledger = CompletionLedger.forIntent(intent);

        assertThat(tracker.progress(intent, ledger)).isEqualTo(new Progress(2, 0));

        ledger = ledger.markComplete("A");
        assertThat(tracker.progress(intent, ledger)).isEqualTo(new Progress(2, 1));

        ledger = ledger.markComplete(List.of("A", "B"));
        Progress done = tracker.progress(intent, ledger);
        assertThat(done).isEqualTo(new Progress(2, 2));
        assertThat(done.isComplete()).isTrue();
    }

    @Test
    void testOneSidedIntentInvolvesOneToken() {
        DepositIntent intent = intent("0", "5");

        assertThat(tracker.progress(intent, CompletionLedger.forIntent(intent))).isEqualTo(new Progress(1, 0));
        assertThat(CompletionLedger.forIntent(intent).contains("A")).isFalse();
    }

    @Test
    void testNoIntent() {
        assertThat(tracker.progress(null, CompletionLedger.empty())).isEqualTo(Progress.NONE);
        assertThat(Progress.NONE.isComplete()).isFalse();
    }

    @Test
    void testUnknownSymbolIgnored() {
        CompletionLedger ledger = CompletionLedger.forIntent(intent("1", "2"));

        assertThat(ledger.markComplete("ZZZ")).isSameAs(ledger);
    }

    private static DepositIntent intent(String amountA, String amountB) {
        return new DepositIntent(A, B, new BigDecimal(amountA), new BigDecimal(amountB), new TickRange(-600, 600),
            InputSide.TOKEN0);
    }
}
