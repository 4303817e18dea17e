package com.vpcrouter.proxy;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Where the relayed response is written.
 */
public interface ResponseSink {

    void setStatus(int status);

    void addHeader(String name, String value);

    void setContentLength(long length);

    OutputStream body() throws IOException;

    boolean isCommitted();
}
