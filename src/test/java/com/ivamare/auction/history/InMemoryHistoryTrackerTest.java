package com.ivamare.auction.history;

import com.ivamare.auction.model.Bid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.ivamare.auction.support.AuctionFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryHistoryTracker")
class InMemoryHistoryTrackerTest {

    private InMemoryHistoryTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new InMemoryHistoryTracker();
    }

    @Nested
    class Queries {

        @Test
        void shouldKeepGlobalAndPerBidderOrder() {
            Bid first = new Bid(ALICE, new BigDecimal("100"));
            Bid second = new Bid(BOB, new BigDecimal("105"));
            Bid third = new Bid(ALICE, new BigDecimal("120"));

            tracker.recordBid(first);
            tracker.recordBid(second);
            tracker.recordBid(third);

            assertEquals(List.of(first, second, third), tracker.allBids());
            assertEquals(List.of(first, third), tracker.bidsOf(ALICE));
            assertEquals(List.of(second), tracker.bidsOf(BOB));
        }

        @Test
        void shouldReturnEmptyListsForUnknownParticipant() {
            assertTrue(tracker.bidsOf(CAROL).isEmpty());
            assertTrue(tracker.refundsOf(CAROL).isEmpty());
            assertTrue(tracker.commissionsOf(CAROL).isEmpty());
        }

        @Test
        void shouldReturnSnapshotsNotLiveViews() {
            tracker.recordRefund(ALICE, new BigDecimal("98"));
            List<BigDecimal> refunds = tracker.refundsOf(ALICE);

            tracker.recordRefund(ALICE, new BigDecimal("99"));

            assertEquals(1, refunds.size());
            assertThrows(UnsupportedOperationException.class, () -> refunds.add(BigDecimal.ONE));
            assertThrows(UnsupportedOperationException.class, () -> tracker.allBids().add(new Bid(BOB, BigDecimal.ONE)));
        }

        @Test
        void shouldSumCommissionsAndRefundsAcrossParticipants() {
            tracker.recordCommission(ALICE, new BigDecimal("2"));
            tracker.recordCommission(BOB, new BigDecimal("2.1"));
            tracker.recordRefund(ALICE, new BigDecimal("98"));
            tracker.recordRefund(BOB, new BigDecimal("102.9"));

            assertThat(tracker.totalCommissions()).isEqualByComparingTo("4.1");
            assertThat(tracker.totalRefunds()).isEqualByComparingTo("200.9");
        }
    }

    @Nested
    class Rollback {

        @Test
        void shouldDiscardOnlyEntriesAfterCheckpoint() {
            tracker.recordBid(new Bid(ALICE, new BigDecimal("100")));
            HistoryTracker.Checkpoint checkpoint = tracker.checkpoint();

            tracker.recordBid(new Bid(BOB, new BigDecimal("105")));
            tracker.recordCommission(ALICE, new BigDecimal("2"));
            tracker.recordRefund(ALICE, new BigDecimal("98"));

            tracker.rollbackTo(checkpoint);

            assertEquals(List.of(new Bid(ALICE, new BigDecimal("100"))), tracker.allBids());
            assertTrue(tracker.bidsOf(BOB).isEmpty());
            assertTrue(tracker.commissionsOf(ALICE).isEmpty());
            assertTrue(tracker.refundsOf(ALICE).isEmpty());
            assertEquals(checkpoint, tracker.checkpoint());
        }

        @Test
        void shouldBeNoOpAtCurrentPosition() {
            tracker.recordBid(new Bid(ALICE, BigDecimal.ONE));

            tracker.rollbackTo(tracker.checkpoint());

            assertEquals(1, tracker.allBids().size());
        }

        @Test
        void shouldRejectCheckpointAheadOfHistory() {
            assertThrows(IllegalStateException.class, () ->
                tracker.rollbackTo(new HistoryTracker.Checkpoint(3)));
        }
    }
}
