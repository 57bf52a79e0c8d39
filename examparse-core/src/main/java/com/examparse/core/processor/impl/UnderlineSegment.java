package com.examparse.core.processor.impl;

import lombok.Value;

/**
 * Horizontal stroke in top-down page coordinates, the same space PDFBox reports text baselines in.
 */
@Value
class UnderlineSegment {
    float minX;
    float maxX;
    float y;
}
