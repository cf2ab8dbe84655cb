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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.concurrent.locks.ReentrantLock;

import pulse.core.Disposable;
import pulse.core.Disposables;
import pulse.util.annotation.Nullable;
import pulse.util.concurrent.Bag;

/**
 * The shared state behind {@link SignalProducer#buffer(int)}: a log of the latest
 * values, bounded by {@code capacity}, plus the terminal event once received. Each
 * started producer replays the log then follows live events.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
final class ProducerBuffer<T, E> implements SignalProducer.StartHandler<T, E>, Observer<T, E> {

	final int           capacity;
	final ReentrantLock lock   = new ReentrantLock();
	final ArrayDeque<Event<T, E>> events = new ArrayDeque<>();

	@Nullable
	Event<T, E>         terminationEvent;

	/**
	 * Copied on write so deliveries can iterate the previous snapshot, null once
	 * terminated.
	 */
	@Nullable
	Bag<Observer<T, E>> observers = new Bag<>();

	ProducerBuffer(int capacity) {
		this.capacity = capacity;
	}

	@Override
	public void start(Observer<T, E> observer, Disposable.Composite disposable) {
		Bag.RemovalToken token = null;
		lock.lock();
		try {
			Bag<Observer<T, E>> current = observers;
			if (current != null) {
				Bag<Observer<T, E>> next = current.copy();
				token = next.insert(observer);
				observers = next;
			}

			// the replayed observer may feed this buffer again
			for (Event<T, E> event : new ArrayList<>(events)) {
				observer.onEvent(event);
			}

			Event<T, E> terminal = terminationEvent;
			if (terminal != null) {
				observer.onEvent(terminal);
			}
		}
		finally {
			lock.unlock();
		}

		if (token != null) {
			Bag.RemovalToken t = token;
			disposable.add(Disposables.action(() -> removeObserver(t)));
		}
	}

	void removeObserver(Bag.RemovalToken token) {
		lock.lock();
		try {
			Bag<Observer<T, E>> current = observers;
			if (current != null) {
				Bag<Observer<T, E>> next = current.copy();
				if (next.remove(token)) {
					observers = next;
				}
			}
		}
		finally {
			lock.unlock();
		}
	}

	@Override
	public void onEvent(Event<T, E> event) {
		lock.lock();
		try {
			Bag<Observer<T, E>> liveObservers = observers;
			if (liveObservers == null) {
				return;
			}

			if (event.isTerminating()) {
				observers = null;
				terminationEvent = event;
			}
			else {
				events.addLast(event);
				while (events.size() > capacity) {
					events.removeFirst();
				}
			}

			for (Observer<T, E> observer : liveObservers) {
				observer.onEvent(event);
			}
		}
		finally {
			lock.unlock();
		}
	}
}
