// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiquidityDepositApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiquidityDepositApplication.class, args);
    }
}
