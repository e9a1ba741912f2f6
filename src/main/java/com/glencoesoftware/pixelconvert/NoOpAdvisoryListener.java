/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

public class NoOpAdvisoryListener implements IAdvisoryListener {

  @Override
  public void notifyAdvisory(Advisory advisory, String detail) {
  }

}
