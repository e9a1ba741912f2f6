/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.EventListener;

public interface IAdvisoryListener extends EventListener {

  /**
   * Indicates that a conversion succeeded, but some part of the result
   * was guessed.
   *
   * @param advisory kind of guess that was made
   * @param detail description of the guess, including the chosen values
   */
  void notifyAdvisory(Advisory advisory, String detail);

}
