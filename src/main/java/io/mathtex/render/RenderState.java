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

package io.mathtex.render;

/**
 * Pen position (x and baseline y) and font size for the part of the tree being painted.
 */
class RenderState {
  int x;
  int y;
  int fontSize;

  RenderState(int x, int y, int fontSize) {
    this.x        = x;
    this.y        = y;
    this.fontSize = fontSize;
  }

  @Override
  public String toString() {
    return "RenderState{x=" + x + ", y=" + y + ", fontSize=" + fontSize + '}';
  }
}
