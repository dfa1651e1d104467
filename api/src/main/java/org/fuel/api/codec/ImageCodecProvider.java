/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fuel.api.codec;

/**
 * The {@code ImageCodecProvider} instance manufactures an {@link ImageCodec} instance, which is
 * available in the system.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}.
 */
public interface ImageCodecProvider {

    /**
     * Returns the name of the {@link ImageCodec}.
     *
     * @return the name of {@link ImageCodec}
     */
    String getCodecName();

    /**
     * Returns the rank of the {@link ImageCodec}. The highest rank wins when no codec is
     * configured.
     *
     * @return the rank of {@link ImageCodec}
     */
    int getCodecRank();

    /**
     * Returns the instance of the {@link ImageCodec} class this provider should bind to.
     *
     * @return the instance of {@link ImageCodec}
     */
    ImageCodec getCodec();
}
