package com.ivamare.auction.api.impl;

import com.ivamare.auction.engine.BiddingEngine;
import com.ivamare.auction.engine.ClaimsManager;
import com.ivamare.auction.event.AuctionEventLog;
import com.ivamare.auction.exception.AuctionClosedException;
import com.ivamare.auction.exception.AuctionException;
import com.ivamare.auction.exception.AuctionStillOpenException;
import com.ivamare.auction.exception.InsufficientIncrementException;
import com.ivamare.auction.exception.NothingToClaimException;
import com.ivamare.auction.exception.TransferFailedException;
import com.ivamare.auction.history.InMemoryHistoryTracker;
import com.ivamare.auction.model.AuctionEvent;
import com.ivamare.auction.model.AuctionEventType;
import com.ivamare.auction.model.AuctionPhase;
import com.ivamare.auction.model.AuctionStatus;
import com.ivamare.auction.model.AuctionSummary;
import com.ivamare.auction.model.Bid;
import com.ivamare.auction.model.ParticipantId;
import com.ivamare.auction.state.AuctionState;
import com.ivamare.auction.support.ManualValueLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.ivamare.auction.support.AuctionFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultAuction")
class DefaultAuctionTest {

    private ManualValueLedger ledger;
    private InMemoryHistoryTracker history;
    private AuctionEventLog eventLog;
    private DefaultAuction auction;

    @BeforeEach
    void setUp() {
        ledger = new ManualValueLedger();
        history = new InMemoryHistoryTracker();
        eventLog = new AuctionEventLog();
        AuctionState state = new AuctionState(defaultConfig(), ledger.now());
        auction = new DefaultAuction(
            state,
            history,
            new BiddingEngine(state, history, ledger, eventLog),
            new ClaimsManager(state, history, ledger, eventLog),
            ledger
        );
    }

    @Test
    @DisplayName("should settle the reference two-bidder auction")
    void shouldSettleReferenceAuction() {
        ledger.at(0);
        auction.placeBid(ALICE, new BigDecimal("100"));
        assertThat(auction.highestBid()).isEqualByComparingTo("100");
        assertEquals(new AuctionStatus(false, Duration.ofSeconds(120)), auction.state());

        ledger.at(100);
        auction.placeBid(BOB, new BigDecimal("105"));
        assertThat(auction.highestBid()).isEqualByComparingTo("105");
        assertEquals(Duration.ofSeconds(30), auction.timeLeft());
        assertThat(ledger.totalTransferredTo(ALICE)).isEqualByComparingTo("98");
        assertThat(auction.commissionHistory(ALICE)).usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("2"));

        ledger.at(200);
        assertThrows(AuctionClosedException.class, () -> auction.placeBid(CAROL, new BigDecimal("110.25")));

        assertThat(auction.claimCommission(OWNER)).isEqualByComparingTo("4.1");
        assertThat(auction.claimProceeds(OWNER)).isEqualByComparingTo("102.9");
        assertThat(ledger.totalTransferredTo(HOUSE)).isEqualByComparingTo("4.1");
        assertThat(ledger.totalTransferredTo(SELLER)).isEqualByComparingTo("102.9");

        assertEquals(Optional.of(BOB), auction.highestBidder());
        assertEquals(List.of(new Bid(ALICE, new BigDecimal("100")), new Bid(BOB, new BigDecimal("105"))),
            auction.allBids());
        assertTrue(auction.bidHistory(CAROL).isEmpty());
    }

    @Nested
    class Queries {

        @Test
        void shouldReportOpenAuctionBeforeAnyBid() {
            ledger.at(20);

            assertFalse(auction.isEnded());
            assertEquals(Duration.ofSeconds(100), auction.timeLeft());
            assertTrue(auction.highestBidder().isEmpty());
            assertThat(auction.minimumNextBid()).isEqualByComparingTo("0");
        }

        @Test
        void shouldSummarizePhases() {
            ledger.at(0);
            auction.placeBid(ALICE, new BigDecimal("50"));
            assertEquals(AuctionPhase.OPEN, auction.summary().phase());

            ledger.at(120);
            assertTrue(auction.isEnded());
            assertEquals(AuctionPhase.ENDED, auction.summary().phase());

            assertTrue(auction.finalizeAuction());
            AuctionSummary summary = auction.summary();
            assertEquals(AuctionPhase.FINALIZED, summary.phase());
            assertThat(summary.proceedsPending()).isEqualByComparingTo("49");
            assertThat(summary.commissionTotal()).isEqualByComparingTo("1");
        }

        @Test
        void shouldRejectFinalizeWhileOpen() {
            ledger.at(10);

            assertThrows(AuctionStillOpenException.class, auction::finalizeAuction);
        }

        @Test
        void shouldRefundHistoryPerParticipant() {
            ledger.at(0);
            auction.placeBid(ALICE, new BigDecimal("100"));
            auction.placeBid(BOB, new BigDecimal("105"));
            auction.placeBid(ALICE, new BigDecimal("110.25"));

            assertThat(auction.refundHistory(ALICE)).usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("98"));
            assertThat(auction.refundHistory(BOB)).usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("102.9"));
            assertEquals(2, auction.bidHistory(ALICE).size());
        }
    }

    @Nested
    class Properties {

        @Test
        void shouldKeepIncreasingHighestBidAndConserveValueOverRandomBidding() {
            Random random = new Random(42);
            List<ParticipantId> bidders = List.of(ALICE, BOB, CAROL);
            BigDecimal received = BigDecimal.ZERO;
            BigDecimal lastHighest = BigDecimal.ZERO;
            long second = 0;

            for (int i = 0; i < 200; i++) {
                second += random.nextInt(3);
                ledger.at(second);
                if (auction.isEnded()) {
                    break;
                }

                ParticipantId bidder = bidders.get(random.nextInt(bidders.size()));
                BigDecimal minimum = auction.minimumNextBid().max(BigDecimal.ONE);
                // Roughly one in four attempts is deliberately too low
                BigDecimal amount = random.nextInt(4) == 0
                    ? minimum.subtract(new BigDecimal("0.01"))
                    : minimum.add(BigDecimal.valueOf(random.nextInt(20)));

                try {
                    auction.placeBid(bidder, amount);
                    received = received.add(amount);
                    assertThat(auction.highestBid()).isGreaterThan(lastHighest);
                    if (lastHighest.signum() > 0) {
                        assertThat(auction.highestBid())
                            .isGreaterThanOrEqualTo(lastHighest.multiply(new BigDecimal("1.05")));
                    }
                    lastHighest = auction.highestBid();
                } catch (InsufficientIncrementException e) {
                    assertThat(auction.highestBid()).isEqualByComparingTo(lastHighest);
                }
            }

            ledger.at(second + 10_000);
            auction.claimCommission(OWNER);
            auction.claimProceeds(OWNER);

            assertThat(ledger.totalTransferred()).isEqualByComparingTo(received);
            assertThat(history.totalCommissions()).isEqualByComparingTo(ledger.totalTransferredTo(HOUSE));
            assertThrows(NothingToClaimException.class, () -> auction.claimCommission(OWNER));
            assertThrows(NothingToClaimException.class, () -> auction.claimProceeds(OWNER));
        }

        @Test
        void shouldRejectEveryBidAfterDeadline() {
            ledger.at(0);
            auction.placeBid(ALICE, new BigDecimal("10"));

            for (long t = 120; t < 130; t++) {
                ledger.at(t);
                AuctionException e = assertThrows(AuctionClosedException.class, () ->
                    auction.placeBid(BOB, new BigDecimal("1000")));
                assertEquals("AUCTION_CLOSED", e.getCode().getValue());
            }
            assertEquals(1, auction.allBids().size());
        }
    }

    @Nested
    class Reentrancy {

        @Test
        void shouldLetRefundedBidderRebidFromInsideRefund() {
            ledger.at(0);
            auction.placeBid(ALICE, new BigDecimal("100"));
            List<ParticipantId> leadersSeen = new ArrayList<>();
            ledger.onTransfer(transfer -> {
                leadersSeen.add(auction.highestBidder().orElse(null));
                if (transfer.to().equals(ALICE) && auction.bidHistory(ALICE).size() == 1) {
                    auction.placeBid(ALICE, new BigDecimal("110.25"));
                }
            });

            auction.placeBid(BOB, new BigDecimal("105"));

            assertEquals(BOB, leadersSeen.get(0));
            assertEquals(ALICE, auction.highestBidder().orElse(null));
            assertThat(auction.highestBid()).isEqualByComparingTo("110.25");
            assertEquals(3, auction.allBids().size());
            assertThat(auction.refundHistory(BOB)).usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("102.9"));
            assertThat(eventLog.events()).extracting(AuctionEvent::type, AuctionEvent::participant)
                .containsExactly(
                    tuple(AuctionEventType.NEW_BID, ALICE),
                    tuple(AuctionEventType.NEW_BID, BOB),
                    tuple(AuctionEventType.REFUNDED, ALICE),
                    tuple(AuctionEventType.NEW_BID, ALICE),
                    tuple(AuctionEventType.REFUNDED, BOB));
        }

        @Test
        void shouldDropNestedBidEventsWhenOuterTransferFails() {
            ledger.at(0);
            auction.placeBid(ALICE, new BigDecimal("100"));
            ledger.onTransfer(transfer -> {
                if (transfer.to().equals(ALICE)) {
                    auction.placeBid(CAROL, new BigDecimal("200"));
                    throw new TransferFailedException(ALICE, transfer.amount(), "recipient rejects value");
                }
            });

            assertThrows(TransferFailedException.class, () -> auction.placeBid(BOB, new BigDecimal("105")));

            assertEquals(ALICE, auction.highestBidder().orElse(null));
            assertThat(auction.highestBid()).isEqualByComparingTo("100");
            assertEquals(1, auction.allBids().size());
            assertTrue(auction.bidHistory(CAROL).isEmpty());
            assertTrue(auction.refundHistory(BOB).isEmpty());
            assertThat(eventLog.events()).extracting(AuctionEvent::type, AuctionEvent::participant)
                .containsExactly(tuple(AuctionEventType.NEW_BID, ALICE));
        }

        @Test
        void shouldPublishEachClaimOnce() {
            ledger.at(0);
            auction.placeBid(ALICE, new BigDecimal("100"));
            ledger.at(120);
            ledger.onTransfer(transfer -> {
                try {
                    auction.claimProceeds(OWNER);
                } catch (NothingToClaimException e) {
                    // expected: balance already zeroed by the outer claim
                }
            });

            auction.claimProceeds(OWNER);

            assertEquals(1, eventLog.eventsOfType(AuctionEventType.PROCEEDS_TRANSFERRED).size());
            assertThat(ledger.totalTransferredTo(SELLER)).isEqualByComparingTo("98");
        }
    }
}
