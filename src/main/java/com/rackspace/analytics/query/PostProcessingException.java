/*
 * Copyright 2023 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.analytics.query;

import lombok.Getter;

@Getter
public class PostProcessingException extends Exception {

  public enum Kind {
    BUCKET_CLIPPING
  }

  private final Kind kind;

  public PostProcessingException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static PostProcessingException bucketClipping(Object value, Throwable cause) {
    return new PostProcessingException(Kind.BUCKET_CLIPPING,
        "Error Clipping values to bucket sizes: " + value, cause);
  }
}
