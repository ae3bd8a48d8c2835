package com.astrazeneca.tmber.printers;

/**
 * Abstract class for rows of the output tables. Child classes define the columns and their order.
 */
public abstract class OutputRow {
    protected final String delimiter = "\t";
}
