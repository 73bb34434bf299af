package com.packlabels.core.document;

/**
 * Marker for the page kinds a {@link LabelDocument} is made of.
 */
public interface DocumentPage {
}
