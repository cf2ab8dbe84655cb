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

import org.junit.jupiter.api.Test;
import pulse.core.Disposable;
import pulse.test.observer.TestObserver;

import static org.assertj.core.api.Assertions.assertThat;

public class ProducerBufferTest {

	@Test
	public void replaysLatestValuesUpToCapacityThenTermination() {
		SignalProducer.Buffer<Integer, String> buffer = SignalProducer.buffer(2);
		buffer.observer().sendNext(1);
		buffer.observer().sendNext(2);
		buffer.observer().sendNext(3);
		buffer.observer().sendCompleted();

		TestObserver<Integer, String> observer = TestObserver.create();
		buffer.producer().start(observer);

		assertThat(observer.getEvents()).containsExactly(Event.next(2), Event.next(3), Event.completed());
	}

	@Test
	public void zeroCapacityOnlyReplaysTermination() {
		SignalProducer.Buffer<Integer, String> buffer = SignalProducer.buffer(0);
		buffer.observer().sendNext(1);
		buffer.observer().sendCompleted();

		TestObserver<Integer, String> observer = TestObserver.create();
		buffer.producer().start(observer);

		assertThat(observer.getEvents()).containsExactly(Event.completed());
	}

	@Test
	public void terminationDoesNotCountAgainstCapacity() {
		SignalProducer.Buffer<Integer, String> buffer = SignalProducer.buffer(1);
		buffer.observer().sendNext(1);
		buffer.observer().sendNext(2);
		buffer.observer().sendError("boom");

		TestObserver<Integer, String> observer = TestObserver.create();
		buffer.producer().start(observer);

		assertThat(observer.getEvents()).containsExactly(Event.next(2), Event.error("boom"));
	}

	@Test
	public void replaysThenFollowsLiveEvents() {
		SignalProducer.Buffer<Integer, String> buffer = SignalProducer.buffer();
		buffer.observer().sendNext(1);

		TestObserver<Integer, String> early = TestObserver.create();
		buffer.producer().start(early);
		buffer.observer().sendNext(2);

		TestObserver<Integer, String> late = TestObserver.create();
		buffer.producer().start(late);
		buffer.observer().sendNext(3);
		buffer.observer().sendCompleted();

		assertThat(early.getEvents()).containsExactly(Event.next(1), Event.next(2), Event.next(3),
				Event.completed());
		assertThat(late.getEvents()).isEqualTo(early.getEvents());
	}

	@Test
	public void eventsAfterTerminationAreIgnored() {
		SignalProducer.Buffer<Integer, String> buffer = SignalProducer.buffer();
		buffer.observer().sendCompleted();
		buffer.observer().sendNext(1);
		buffer.observer().sendError("late");

		TestObserver<Integer, String> observer = TestObserver.create();
		buffer.producer().start(observer);

		assertThat(observer.getEvents()).containsExactly(Event.completed());
	}

	@Test
	public void disposingARunDetachesIt() {
		SignalProducer.Buffer<Integer, String> buffer = SignalProducer.buffer();
		TestObserver<Integer, String> detached = TestObserver.create();
		TestObserver<Integer, String> attached = TestObserver.create();

		Disposable run = buffer.producer().start(detached);
		buffer.producer().start(attached);
		run.dispose();
		buffer.observer().sendNext(1);

		assertThat(detached.getEvents()).containsExactly(Event.interrupted());
		assertThat(attached.getEvents()).containsExactly(Event.next(1));
	}

	@Test
	public void observerFeedingTheBufferFromReplayIsSupported() {
		SignalProducer.Buffer<Integer, String> buffer = SignalProducer.buffer();
		buffer.observer().sendNext(1);
		TestObserver<Integer, String> observer = TestObserver.create();

		buffer.producer()
		      .doOnNext(v -> {
			      if (v < 3) {
				      buffer.observer().sendNext(v + 1);
			      }
		      })
		      .start(observer);

		assertThat(observer.getReceivedOnNext()).containsExactly(1, 2, 3);
	}
}
