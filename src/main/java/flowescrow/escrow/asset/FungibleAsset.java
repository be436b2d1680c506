package flowescrow.escrow.asset;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Transferable-balance token the escrow moves value through.
 * <p>
 * Both calls run inside the escrow operation's transaction, so a rejected transfer
 * anywhere in an operation rolls back the transfers made before it as well.
 * Implementations may call back into arbitrary code; the escrow guards against that.
 */
public interface FungibleAsset {

    /**
     * Move {@code amount} from {@code payer} into escrow custody.
     *
     * @return false if the payer cannot cover the amount
     */
    boolean debitFrom(Connection tx, String payer, long amount) throws SQLException;

    /**
     * Move {@code amount} out of escrow custody to {@code recipient}.
     *
     * @return false if custody cannot cover the amount or the recipient is rejected
     */
    boolean creditTo(Connection tx, String recipient, long amount) throws SQLException;

    /**
     * Issue {@code amount} new tokens to {@code account}.
     *
     * @return false if the asset refuses the issue
     */
    boolean mint(Connection tx, String account, long amount) throws SQLException;

    /**
     * Balance of an account; 0 for unknown accounts.
     */
    long balanceOf(String account);

    /**
     * Account holding escrowed funds. It can never be a transfer recipient.
     */
    String custodyAccount();
}
