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

package pulse.core.scheduler;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates the threads of the single schedulers: named {@code prefix-N}, marked
 * {@link NonBlocking} and logging uncaught exceptions.
 */
final class PulseThreadFactory implements ThreadFactory {

	final String     prefix;
	final AtomicLong counter;
	final boolean    daemon;

	PulseThreadFactory(String prefix, AtomicLong counter, boolean daemon) {
		this.prefix = prefix;
		this.counter = counter;
		this.daemon = daemon;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread t = new NonBlockingThread(runnable, prefix + "-" + counter.incrementAndGet());
		t.setDaemon(daemon);
		t.setUncaughtExceptionHandler(Schedulers::defaultUncaughtException);
		return t;
	}

	static final class NonBlockingThread extends Thread implements NonBlocking {

		NonBlockingThread(Runnable target, String name) {
			super(target, name);
		}
	}
}
