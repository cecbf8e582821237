/*
 * Copyright © 2022,2023 James Crawford
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
 *
 */

package io.mathtex;

/**
 * Base for all errors reported by MathTex. Errors found in the markup carry the
 * {@link Location} they refer to and their message then includes the line and
 * column followed by the offending source line.
 */
public class MathTexError extends RuntimeException {

  private final String   errorMessage;
  private final Location location;

  public MathTexError(String errorMessage) {
    this(errorMessage, null, null);
  }

  /**
   * Error at a position in the markup
   * @param errorMessage  the error message without any location details
   * @param location      where in the markup the error was found
   */
  public MathTexError(String errorMessage, Location location) {
    this(errorMessage, location, null);
  }

  /**
   * Error caused by a failure outside the markup (reading options, writing images).
   * The message of the cause is appended to the error message.
   */
  public MathTexError(String errorMessage, Throwable cause) {
    this(errorMessage + ": " + (cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage()), null, cause);
  }

  private MathTexError(String errorMessage, Location location, Throwable cause) {
    super(errorMessage, cause);
    this.errorMessage = errorMessage;
    this.location     = location;
  }

  public Location getLocation() {
    return location;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  /**
   * @return the error message followed by line and column if there is a location
   */
  public String getSingleLineMessage() {
    return location == null ? errorMessage
                            : errorMessage + " @ line " + location.getLineNum() + ", column " + location.getColumn();
  }

  @Override
  public String getMessage() {
    return location == null ? errorMessage : getSingleLineMessage() + "\n" + location.getMarkedSourceLine();
  }
}
