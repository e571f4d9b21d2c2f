package com.tarterware.cvi.exceptions;

/**
 * Thrown when a pipeline step receives no usable geometry, such as an empty
 * coastline segment set. This is fatal for the step that raised it.
 */
public class EmptyInputException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    public EmptyInputException(String message)
    {
        super(message);
    }
}
