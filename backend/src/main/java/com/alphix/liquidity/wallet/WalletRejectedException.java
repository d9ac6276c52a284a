package com.alphix.liquidity.wallet;

import com.alphix.liquidity.constants.DepositConstants;

/**
 * The user declined a signature or transaction request.
 */
public class WalletRejectedException extends RuntimeException {

    public WalletRejectedException(final String message) {
        super(message);
    }

    public static boolean isRejectionCode(final int code) {
        return code == DepositConstants.USER_REJECTED_CODE;
    }
}
