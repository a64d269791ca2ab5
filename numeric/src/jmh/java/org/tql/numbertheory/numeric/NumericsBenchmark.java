/*
 * Copyright contributors to tql.
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
package org.tql.numbertheory.numeric;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
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
public class NumericsBenchmark {
  protected static final int SAMPLE_SIZE = 30_000;

  @Param({"2", "3", "7"})
  private int degree;

  protected long[] aPool;
  protected long[] bPool;
  protected long[] ePool;
  protected int index;

  @Setup(Level.Iteration)
  public void setUp() {
    aPool = new long[SAMPLE_SIZE];
    bPool = new long[SAMPLE_SIZE];
    ePool = new long[SAMPLE_SIZE];

    final ThreadLocalRandom random = ThreadLocalRandom.current();
    for (int i = 0; i < SAMPLE_SIZE; i++) {
      aPool[i] = random.nextLong();
      bPool[i] = random.nextLong();
      ePool[i] = random.nextLong(0, 64);
    }

    index = 0;
  }

  @Benchmark
  public void exgcd(final Blackhole blackhole) {
    blackhole.consume(Numerics.exgcd(aPool[index], bPool[index]));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void pow(final Blackhole blackhole) {
    blackhole.consume(Numerics.pow(aPool[index], ePool[index]));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void iroot(final Blackhole blackhole) {
    // Odd degrees accept negative radicands; even ones need the magnitude.
    long x = degree % 2 == 0 ? aPool[index] >>> 1 : aPool[index];
    blackhole.consume(Numerics.iroot(x, degree));
    index = (index + 1) % SAMPLE_SIZE;
  }
}
