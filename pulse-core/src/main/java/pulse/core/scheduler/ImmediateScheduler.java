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

import pulse.core.Disposable;
import pulse.core.Disposables;

/**
 * Executes tasks on the caller's thread immediately.
 * <p>
 * Use the ImmediateScheduler.instance() to get a shared, stateless instance of this scheduler.
 * This scheduler is NOT time-capable (can't schedule with delay / periodically).
 */
final class ImmediateScheduler implements Scheduler {

	private static final ImmediateScheduler INSTANCE = new ImmediateScheduler();

	public static Scheduler instance() {
		return INSTANCE;
	}

	private ImmediateScheduler() {
	}

	static final Disposable FINISHED = Disposables.disposed();

	@Override
	public Disposable schedule(Runnable task) {
		task.run();
		return FINISHED;
	}

	@Override
	public void dispose() {
		//NO-OP
	}

	@Override
	public String toString() {
		return Schedulers.IMMEDIATE;
	}
}
