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

/**
 * Provide the main APIs in {@link pulse.core.signal.SignalProducer} and
 * {@link pulse.core.signal.Signal}, along with {@link pulse.core.signal.Event} and
 * {@link pulse.core.signal.Observer}.
 *
 * <h2>SignalProducer</h2>
 * A cold, restartable factory of event streams. Nothing happens until one of the
 * {@code start} methods is invoked, and every start runs independently.
 *
 * <h2>Signal</h2>
 * A hot, multicast stream of events, carrying at most one terminal event.
 */
@NonNullApi
package pulse.core.signal;

import pulse.util.annotation.NonNullApi;
