package flowescrow.escrow.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeePolicyTest {

    @Test
    void splitAtTenPercent() {
        FeeSplit split = new FeePolicy(1000, "treasury").split(20_000);
        assertEquals(20_000, split.gross());
        assertEquals(2_000, split.fee());
        assertEquals(18_000, split.workerAmount());
    }

    @Test
    void feeRoundsDown() {
        FeePolicy policy = new FeePolicy(500, "treasury");
        assertEquals(499, policy.split(9_999).fee());
        assertEquals(0, policy.split(19).fee());
        assertEquals(1, policy.split(20).fee());
        assertEquals(0, policy.split(0).fee());
    }

    @Test
    void zeroFeePaysEverythingToWorker() {
        FeeSplit split = new FeePolicy(0, "treasury").split(12_345);
        assertEquals(0, split.fee());
        assertEquals(12_345, split.workerAmount());
    }

    @Test
    void noOverflowOnLargeAmounts() {
        FeePolicy policy = new FeePolicy(FeePolicy.MAX_FEE_BPS, "treasury");
        FeeSplit split = policy.split(Long.MAX_VALUE);

        assertTrue(split.fee() > 0);
        assertEquals(Long.MAX_VALUE, split.fee() + split.workerAmount());
        // floor(MAX * 0.2)
        assertEquals(Long.MAX_VALUE / 5, split.fee());
    }

    @Test
    void rejectsOutOfRangeRate() {
        assertThrows(IllegalArgumentException.class, () -> new FeePolicy(2001, "treasury"));
        assertThrows(IllegalArgumentException.class, () -> new FeePolicy(-1, "treasury"));
        assertThrows(IllegalArgumentException.class, () -> new FeePolicy(100, " "));
        assertThrows(IllegalArgumentException.class, () -> new FeePolicy(100, "treasury").split(-1));
    }

    @Test
    void withersKeepOtherField() {
        FeePolicy policy = new FeePolicy(100, "a");
        assertEquals(new FeePolicy(200, "a"), policy.withFeeBps(200));
        assertEquals(new FeePolicy(100, "b"), policy.withFeeRecipient("b"));
    }
}
