// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.model;

/**
 * Where a deposit session stands. Exactly one variant at a time; each carries the payload its
 * next action needs.
 */
public sealed interface DepositState {

    String name();

    record Input() implements DepositState {
        @Override
        public String name() {
            return "input";
        }
    }

    record Approving(DepositIntent intent, PreparedStep.NeedsErc20Approval approval) implements DepositState {
        @Override
        public String name() {
            return "approve";
        }
    }

    record PermitSigning(DepositIntent intent, PreparedStep.NeedsPermitSignature permit) implements DepositState {
        @Override
        public String name() {
            return "permit2Sign";
        }
    }

    record Minting(DepositIntent intent, RawTransaction transaction) implements DepositState {
        @Override
        public String name() {
            return "mint";
        }
    }

    record Done(DepositIntent intent, String txHash) implements DepositState {
        @Override
        public String name() {
            return "done";
        }
    }

    static DepositState input() {
        return new Input();
    }
}
