// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.Random;

/**
 * Makes {@link ServerRegistry#pickRandom} deterministic: always the first
 * remaining candidate in registration order.
 */
final class FirstCandidateRandom extends Random {

    @Override
    public int nextInt(int bound) {
        return 0;
    }
}
