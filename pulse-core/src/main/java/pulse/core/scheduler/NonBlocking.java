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

/**
 * A marker interface that is detected on {@link Thread Threads} while executing Pulse
 * blocking APIs, resulting in these calls throwing an exception.
 * <p>
 * See {@link Schedulers#isInNonBlockingThread()} and
 * {@link Schedulers#isNonBlockingThread(Thread)} for a check that detects this marker
 * interface.
 */
public interface NonBlocking { }
