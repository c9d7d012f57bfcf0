/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.warpkit.command.bench;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Built-in workloads of the bench command. Each runs for roughly the requested number of
 * microseconds.
 */
public enum Workload {

    /** Parks the thread, measuring scheduler and timer resolution. */
    SLEEP {
        @Override
        public void run(long micros) {
            long deadline = System.nanoTime() + TimeUnit.MICROSECONDS.toNanos(micros);
            long remaining;
            while ((remaining = deadline - System.nanoTime()) > 0) {
                LockSupport.parkNanos(remaining);
                if (Thread.currentThread().isInterrupted()) {
                    return;
                }
            }
        }
    },

    /** Busy-waits on the CPU, measuring clock overhead and jitter. */
    SPIN {
        @Override
        public void run(long micros) {
            long deadline = System.nanoTime() + TimeUnit.MICROSECONDS.toNanos(micros);
            while (System.nanoTime() - deadline < 0) {
                Thread.onSpinWait();
            }
        }
    };

    /**
     * Runs one unit of work.
     *
     * @param micros the target duration in microseconds
     */
    public abstract void run(long micros);
}
