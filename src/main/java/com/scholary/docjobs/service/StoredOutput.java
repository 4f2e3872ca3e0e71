package com.scholary.docjobs.service;

import java.io.InputStream;

/** An opened job output. The caller closes the stream. */
public record StoredOutput(String filename, String contentType, InputStream content) {}
