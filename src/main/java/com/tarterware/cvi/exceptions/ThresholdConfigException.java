package com.tarterware.cvi.exceptions;

/**
 * Thrown while building threshold tables from configuration when an entry is
 * missing or malformed. Tables are never built with a bin silently dropped.
 */
public class ThresholdConfigException extends IllegalStateException
{
    private static final long serialVersionUID = 1L;

    public ThresholdConfigException(String message)
    {
        super(message);
    }

    public ThresholdConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
