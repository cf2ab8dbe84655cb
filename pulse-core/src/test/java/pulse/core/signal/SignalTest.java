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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import pulse.core.Disposable;
import pulse.test.FakeDisposable;
import pulse.test.observer.TestObserver;
import pulse.test.util.RaceTestUtils;
import pulse.util.Result;
import pulse.util.function.Tuple2;
import pulse.util.function.Tuples;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class SignalTest {

	@Test
	public void multicastsEventsToObserversInOrder() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> first = TestObserver.create();
		TestObserver<Integer, String> second = TestObserver.create();
		pipe.signal().observe(first);
		pipe.signal().observe(second);

		pipe.observer().sendNext(1);
		pipe.observer().sendNext(2);
		pipe.observer().sendCompleted();

		assertThat(first.getEvents()).containsExactly(Event.next(1), Event.next(2), Event.completed());
		assertThat(second.getEvents()).isEqualTo(first.getEvents());
	}

	@Test
	public void lateObserverOnlySeesLaterEvents() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		pipe.observer().sendNext(1);

		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().observe(observer);
		pipe.observer().sendNext(2);

		assertThat(observer.getReceivedOnNext()).containsExactly(2);
	}

	@Test
	public void eventsAfterTerminationAreDropped() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().observe(observer);

		pipe.observer().sendError("boom");
		pipe.observer().sendNext(1);
		pipe.observer().sendCompleted();

		assertThat(observer.getEvents()).containsExactly(Event.error("boom"));
		assertThat(observer.getProtocolErrors()).isEmpty();
	}

	@Test
	public void observingTerminatedSignalInterruptsImmediately() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		pipe.observer().sendCompleted();

		TestObserver<Integer, String> observer = TestObserver.create();
		Disposable disposable = pipe.signal().observe(observer);

		assertThat(observer.getEvents()).containsExactly(Event.interrupted());
		assertThat(disposable.isDisposed()).isTrue();
	}

	@Test
	public void disposingObservationDetachesObserver() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		Disposable disposable = pipe.signal().observe(observer);

		pipe.observer().sendNext(1);
		disposable.dispose();
		pipe.observer().sendNext(2);
		pipe.observer().sendCompleted();

		assertThat(observer.getEvents()).containsExactly(Event.next(1));
	}

	@Test
	public void generatorDisposableIsDisposedOnTermination() {
		FakeDisposable resource = new FakeDisposable();
		AtomicReference<Observer<Integer, String>> sink = new AtomicReference<>();
		new Signal<Integer, String>(observer -> {
			sink.set(observer);
			return resource;
		});

		sink.get().sendNext(1);
		assertThat(resource.disposed).hasValue(0);

		sink.get().sendCompleted();
		sink.get().sendInterrupted();
		assertThat(resource.disposed).hasValue(1);
	}

	@Test
	public void interruptionSentDuringDeliveryWaitsForIt() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> second = TestObserver.create();
		TestObserver<Integer, String> first = new TestObserver<Integer, String>() {
			@Override
			public void onEvent(Event<Integer, String> event) {
				super.onEvent(event);
				if (event.getType() == Event.Type.NEXT) {
					pipe.observer().sendInterrupted();
				}
			}
		};
		pipe.signal().observe(first);
		pipe.signal().observe(second);

		pipe.observer().sendNext(1);

		assertThat(first.getEvents()).containsExactly(Event.next(1), Event.interrupted());
		assertThat(second.getEvents()).containsExactly(Event.next(1), Event.interrupted());
	}

	@Test
	public void eventSentDuringDeliveryReachesEveryObserverInOrder() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> second = TestObserver.create();
		List<Integer> firstValues = new ArrayList<>();
		pipe.signal().observe(event -> {
			if (event.getType() == Event.Type.NEXT) {
				firstValues.add(event.get());
				if (event.get() < 3) {
					pipe.observer().sendNext(event.get() + 1);
				}
				else {
					pipe.observer().sendCompleted();
				}
			}
		});
		pipe.signal().observe(second);

		pipe.observer().sendNext(1);

		assertThat(firstValues).containsExactly(1, 2, 3);
		assertThat(second.getEvents()).containsExactly(Event.next(1), Event.next(2), Event.next(3),
				Event.completed());
	}

	@Test
	public void interruptionDuringDeliveryDropsQueuedEvents() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> second = TestObserver.create();
		pipe.signal().observe(event -> {
			if (event.getType() == Event.Type.NEXT) {
				pipe.observer().sendNext(2);
				pipe.observer().sendInterrupted();
			}
		});
		pipe.signal().observe(second);

		pipe.observer().sendNext(1);

		assertThat(second.getEvents()).containsExactly(Event.next(1), Event.interrupted());
	}

	@Test
	public void concurrentSendsAreSerialized() {
		for (int round = 0; round < 20; round++) {
			Signal.Pipe<Integer, String> pipe = Signal.pipe();
			int[] received = {0};
			pipe.signal().observe(event -> received[0]++);

			Runnable sender = () -> {
				for (int i = 0; i < 1000; i++) {
					pipe.observer().sendNext(i);
				}
			};
			RaceTestUtils.race(sender, sender);

			assertThat(received[0]).isEqualTo(2000);
		}
	}

	@Test
	public void mapAndFilter() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal()
		    .map(v -> v * 2)
		    .filter(v -> v > 2)
		    .observe(observer);

		pipe.observer().sendNext(1);
		pipe.observer().sendNext(2);
		pipe.observer().sendNext(3);
		pipe.observer().sendCompleted();

		assertThat(observer.getEvents()).containsExactly(Event.next(4), Event.next(6), Event.completed());
	}

	@Test
	public void mapError() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, Integer> observer = TestObserver.create();
		pipe.signal().mapError(String::length).observe(observer);

		pipe.observer().sendError("boom");

		assertThat(observer.expectTerminalError()).isEqualTo(4);
	}

	@Test
	public void takeCompletesAfterCount() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().take(2).observe(observer);

		pipe.observer().sendNext(1);
		pipe.observer().sendNext(2);
		pipe.observer().sendNext(3);

		assertThat(observer.getEvents()).containsExactly(Event.next(1), Event.next(2), Event.completed());
		assertThat(observer.getProtocolErrors()).isEmpty();
	}

	@Test
	public void takeRejectsNegativeCount() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		assertThatIllegalArgumentException().isThrownBy(() -> pipe.signal().take(-1));
	}

	@Test
	public void takeLastKeepsLatestValues() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().takeLast(2).observe(observer);

		pipe.observer().sendNext(1);
		pipe.observer().sendNext(2);
		pipe.observer().sendNext(3);
		assertThat(observer.getEvents()).isEmpty();

		pipe.observer().sendCompleted();
		assertThat(observer.getEvents()).containsExactly(Event.next(2), Event.next(3), Event.completed());
	}

	@Test
	public void skipAndSkipWhile() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> skipped = TestObserver.create();
		TestObserver<Integer, String> skippedWhile = TestObserver.create();
		pipe.signal().skip(2).observe(skipped);
		pipe.signal().skipWhile(v -> v < 3).observe(skippedWhile);

		for (int v : Arrays.asList(1, 2, 3, 1)) {
			pipe.observer().sendNext(v);
		}

		assertThat(skipped.getReceivedOnNext()).containsExactly(3, 1);
		assertThat(skippedWhile.getReceivedOnNext()).containsExactly(3, 1);
	}

	@Test
	public void takeWhileCompletesOnFirstFailingValue() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().takeWhile(v -> v < 3).observe(observer);

		for (int v : Arrays.asList(1, 2, 3, 1)) {
			pipe.observer().sendNext(v);
		}

		assertThat(observer.getEvents()).containsExactly(Event.next(1), Event.next(2), Event.completed());
	}

	@Test
	public void collectSendsAllValuesOnCompletion() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<List<Integer>, String> observer = TestObserver.create();
		pipe.signal().collect().observe(observer);

		pipe.observer().sendNext(1);
		pipe.observer().sendNext(2);
		pipe.observer().sendCompleted();

		assertThat(observer.getReceivedOnNext()).containsExactly(Arrays.asList(1, 2));
		assertThat(observer.isCompleted()).isTrue();
	}

	@Test
	public void collectOfNothingIsEmptyList() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<List<Integer>, String> observer = TestObserver.create();
		pipe.signal().collect().observe(observer);

		pipe.observer().sendCompleted();

		assertThat(observer.getReceivedOnNext()).containsExactly(Collections.emptyList());
	}

	@Test
	public void scanAndReduce() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> scanned = TestObserver.create();
		TestObserver<Integer, String> reduced = TestObserver.create();
		pipe.signal().scan(0, Integer::sum).observe(scanned);
		pipe.signal().reduce(0, Integer::sum).observe(reduced);

		pipe.observer().sendNext(1);
		pipe.observer().sendNext(2);
		pipe.observer().sendNext(3);
		pipe.observer().sendCompleted();

		assertThat(scanned.getReceivedOnNext()).containsExactly(1, 3, 6);
		assertThat(reduced.getEvents()).containsExactly(Event.next(6), Event.completed());
	}

	@Test
	public void reduceOfNothingSendsInitial() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().reduce(42, Integer::sum).observe(observer);

		pipe.observer().sendCompleted();

		assertThat(observer.getEvents()).containsExactly(Event.next(42), Event.completed());
	}

	@Test
	public void skipRepeats() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().skipRepeats().observe(observer);

		for (int v : Arrays.asList(1, 1, 2, 2, 1)) {
			pipe.observer().sendNext(v);
		}

		assertThat(observer.getReceivedOnNext()).containsExactly(1, 2, 1);
	}

	@Test
	public void skipRepeatsWithCustomEquality() {
		Signal.Pipe<String, String> pipe = Signal.pipe();
		TestObserver<String, String> observer = TestObserver.create();
		pipe.signal().skipRepeats(String::equalsIgnoreCase).observe(observer);

		for (String v : Arrays.asList("a", "A", "b")) {
			pipe.observer().sendNext(v);
		}

		assertThat(observer.getReceivedOnNext()).containsExactly("a", "b");
	}

	@Test
	public void combinePrevious() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Tuple2<Integer, Integer>, String> observer = TestObserver.create();
		pipe.signal().combinePrevious(0).observe(observer);

		pipe.observer().sendNext(1);
		pipe.observer().sendNext(2);

		assertThat(observer.getReceivedOnNext()).containsExactly(Tuples.of(0, 1), Tuples.of(1, 2));
	}

	@Test
	public void materializeThenDematerialize() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Event<Integer, String>, NoError> materialized = TestObserver.create();
		TestObserver<Integer, String> dematerialized = TestObserver.create();
		pipe.signal().materialize().observe(materialized);
		Signal.dematerialize(pipe.signal().materialize()).observe(dematerialized);

		pipe.observer().sendNext(1);
		pipe.observer().sendError("boom");

		assertThat(materialized.getEvents()).containsExactly(
				Event.next(Event.next(1)),
				Event.next(Event.error("boom")),
				Event.completed());
		assertThat(dematerialized.getEvents()).containsExactly(Event.next(1), Event.error("boom"));
	}

	@Test
	public void materializeForwardsInterruption() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Event<Integer, String>, NoError> observer = TestObserver.create();
		pipe.signal().materialize().observe(observer);

		pipe.observer().sendInterrupted();

		assertThat(observer.getEvents()).containsExactly(Event.next(Event.interrupted()), Event.interrupted());
	}

	@Test
	public void promoteErrorsPassesValues() {
		Signal.Pipe<Integer, NoError> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		Signal.<Integer, String>promoteErrors(pipe.signal()).observe(observer);

		pipe.observer().sendNext(1);
		pipe.observer().sendCompleted();

		assertThat(observer.getEvents()).containsExactly(Event.next(1), Event.completed());
	}

	@Test
	public void attemptMapFailsOnFirstFailure() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal()
		    .attemptMap(v -> v < 2 ? Result.<Integer, String>success(v * 10) : Result.<Integer, String>failure("bad " + v))
		    .observe(observer);

		pipe.observer().sendNext(1);
		pipe.observer().sendNext(2);
		pipe.observer().sendNext(3);

		assertThat(observer.getEvents()).containsExactly(Event.next(10), Event.error("bad 2"));
	}

	@Test
	public void attemptKeepsValues() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal()
		    .attempt(v -> v % 2 == 1 ? Result.<Void, String>success(null) : Result.<Void, String>failure("even"))
		    .observe(observer);

		pipe.observer().sendNext(1);
		pipe.observer().sendNext(3);
		pipe.observer().sendNext(4);

		assertThat(observer.getEvents()).containsExactly(Event.next(1), Event.next(3), Event.error("even"));
	}

	@Test
	public void takeUntilCompletesOnTrigger() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		Signal.Pipe<Object, NoError> trigger = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().takeUntil(trigger.signal()).observe(observer);

		pipe.observer().sendNext(1);
		trigger.observer().sendNext("stop");
		pipe.observer().sendNext(2);

		assertThat(observer.getEvents()).containsExactly(Event.next(1), Event.completed());
	}

	@Test
	public void takeUntilCompletesOnTriggerCompletion() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		Signal.Pipe<Object, NoError> trigger = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().takeUntil(trigger.signal()).observe(observer);

		trigger.observer().sendCompleted();

		assertThat(observer.getEvents()).containsExactly(Event.completed());
	}

	@Test
	public void takeUntilReplacementSwitchesOnFirstReplacementEvent() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		Signal.Pipe<Integer, String> replacement = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().takeUntilReplacement(replacement.signal()).observe(observer);

		pipe.observer().sendNext(1);
		replacement.observer().sendNext(10);
		pipe.observer().sendNext(2);
		replacement.observer().sendNext(11);
		replacement.observer().sendCompleted();

		assertThat(observer.getEvents()).containsExactly(Event.next(1), Event.next(10), Event.next(11),
				Event.completed());
	}

	@Test
	public void takeUntilReplacementIgnoresOwnCompletion() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		Signal.Pipe<Integer, String> replacement = Signal.pipe();
		TestObserver<Integer, String> observer = TestObserver.create();
		pipe.signal().takeUntilReplacement(replacement.signal()).observe(observer);

		pipe.observer().sendNext(1);
		pipe.observer().sendCompleted();
		assertThat(observer.isTerminated()).isFalse();

		replacement.observer().sendNext(2);
		replacement.observer().sendCompleted();
		assertThat(observer.getEvents()).containsExactly(Event.next(1), Event.next(2), Event.completed());
	}

	@Test
	public void toStringShowsObserverCount() {
		Signal.Pipe<Integer, String> pipe = Signal.pipe();
		pipe.signal().observe(event -> { });
		assertThat(pipe.signal()).hasToString("Signal{observers=1}");

		pipe.observer().sendCompleted();
		assertThat(pipe.signal()).hasToString("Signal{terminated}");
	}
}
