/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default listener; every advisory is logged as a warning.
 */
public class LoggingAdvisoryListener implements IAdvisoryListener {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(LoggingAdvisoryListener.class);

  @Override
  public void notifyAdvisory(Advisory advisory, String detail) {
    LOGGER.warn("{} [{}]", detail, advisory);
  }

}
