/*
 * Copyright (c) 2016-2024 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package pulse.core.signal;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pulse.core.scheduler.Scheduler;
import pulse.core.scheduler.Schedulers;
import pulse.util.Result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BlockingReducersTest {

	Scheduler scheduler;

	@BeforeEach
	public void setUp() {
		scheduler = Schedulers.newSingle("blockingTest");
	}

	@AfterEach
	public void tearDown() {
		scheduler.dispose();
	}

	@Test
	public void singleReturnsTheOnlyValue() {
		assertThat(SignalProducer.<Integer, String>value(1).single()).isEqualTo(Result.success(1));
	}

	@Test
	public void singleIsNullWithoutValueOrWithSeveralValues() {
		assertThat(SignalProducer.<Integer, String>empty().single()).isNull();
		assertThat(SignalProducer.<Integer, String>values(1, 2).single()).isNull();
	}

	@Test
	public void singleReturnsTheError() {
		assertThat(SignalProducer.<Integer, String>error("boom").single()).isEqualTo(Result.failure("boom"));
	}

	@Test
	public void singleStopsTheRunAfterTheSecondValue() {
		AtomicInteger sent = new AtomicInteger();
		SignalProducer.<Integer, String>values(1, 2, 3, 4)
		              .doOnNext(v -> sent.incrementAndGet())
		              .single();

		assertThat(sent).hasValue(2);
	}

	@Test
	public void singleWaitsForAnotherThread() {
		Result<Integer, String> result = SignalProducer.<Integer, String>value(5)
		                                               .startOn(scheduler)
		                                               .single(Duration.ofSeconds(5));

		assertThat(result).isEqualTo(Result.success(5));
	}

	@Test
	public void firstReturnsTheFirstValueAndStopsTheRun() {
		AtomicInteger sent = new AtomicInteger();
		Result<Integer, String> result = SignalProducer.<Integer, String>values(1, 2, 3)
		                                               .doOnNext(v -> sent.incrementAndGet())
		                                               .first();

		assertThat(result).isEqualTo(Result.success(1));
		assertThat(sent).hasValue(1);
		assertThat(SignalProducer.<Integer, String>empty().first()).isNull();
	}

	@Test
	public void lastReturnsTheLastValue() {
		assertThat(SignalProducer.<Integer, String>values(1, 2, 3).last()).isEqualTo(Result.success(3));
		assertThat(SignalProducer.<Integer, String>empty().last()).isNull();
		assertThat(SignalProducer.<Integer, String>values(1, 2).concat(SignalProducer.error("boom")).last())
				.isEqualTo(Result.failure("boom"));
	}

	@Test
	public void awaitReportsCompletionOrError() {
		assertThat(SignalProducer.<Integer, String>values(1, 2).await()).isEqualTo(Result.success(null));
		assertThat(SignalProducer.<Integer, String>empty().await().isSuccess()).isTrue();
		assertThat(SignalProducer.<Integer, String>error("boom").await()).isEqualTo(Result.failure("boom"));
	}

	@Test
	public void awaitWithTimeoutWaitsForADelayedRun() {
		Result<Void, String> result = SignalProducer.<Integer, String>value(1)
		                                            .delay(Duration.ofMillis(50), scheduler)
		                                            .await(Duration.ofSeconds(5));

		assertThat(result.isSuccess()).isTrue();
	}

	@Test
	public void timeoutInterruptsTheRunAndThrows() {
		AtomicBoolean interrupted = new AtomicBoolean();
		SignalProducer<Integer, String> producer = SignalProducer.<Integer, String>never()
		                                                         .doOnInterrupted(() -> interrupted.set(true));

		assertThatIllegalStateException().isThrownBy(() -> producer.single(Duration.ofMillis(100)))
		                                 .withMessageStartingWith("Timeout on blocking read");
		assertThat(interrupted).isTrue();
	}

	@Test
	public void interruptedWaitCancelsTheRunAndRestoresTheFlag() {
		AtomicBoolean cancelled = new AtomicBoolean();
		SignalProducer<Integer, String> producer = SignalProducer.<Integer, String>never()
		                                                         .doOnInterrupted(() -> cancelled.set(true));

		Thread.currentThread().interrupt();
		try {
			assertThatThrownBy(producer::single).hasCauseInstanceOf(InterruptedException.class);
		}
		finally {
			assertThat(Thread.interrupted()).isTrue();
		}
		assertThat(cancelled).isTrue();
	}

	@Test
	public void blockingIsRefusedOnNonBlockingThreads() throws InterruptedException {
		AtomicReference<Throwable> error = new AtomicReference<>();
		CountDownLatch latch = new CountDownLatch(1);

		scheduler.schedule(() -> {
			try {
				SignalProducer.<Integer, String>value(1).single();
			}
			catch (Throwable e) {
				error.set(e);
			}
			finally {
				latch.countDown();
			}
		});

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(error.get()).isInstanceOf(IllegalStateException.class)
		                       .hasMessageContaining("blockingTest");
	}
}
