/*
 * Copyright contributors to gf2m.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License is distributed on
 * an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package org.gf2m.datatypes;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@State(Scope.Thread)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@OutputTimeUnit(value = TimeUnit.NANOSECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@BenchmarkMode(Mode.AverageTime)
public class UInt128Benchmark {
  protected static final int SAMPLE_SIZE = 30_000;
  protected UInt128[] pool;
  protected int[] shifts;
  protected int index;

  @Setup(Level.Iteration)
  public void setUp() {
    pool = new UInt128[SAMPLE_SIZE];
    shifts = new int[SAMPLE_SIZE];

    final ThreadLocalRandom random = ThreadLocalRandom.current();
    for (int i = 0; i < SAMPLE_SIZE; i++) {
      pool[i] = UInt128.fromLimbs(random.nextLong(), random.nextLong());
      shifts[i] = random.nextInt(UInt128.BITSIZE);
    }

    index = 0;
  }

  @Benchmark
  public void shiftLeft(final Blackhole blackhole) {
    blackhole.consume(pool[index].shiftLeft(shifts[index]));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void shiftRight(final Blackhole blackhole) {
    blackhole.consume(pool[index].shiftRight(shifts[index]));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void xor(final Blackhole blackhole) {
    blackhole.consume(pool[index].xor(pool[(index + 1) % SAMPLE_SIZE]));
    index = (index + 1) % SAMPLE_SIZE;
  }
}
