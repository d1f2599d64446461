/**
 * Domain models of the podcast pipeline.
 *
 * <p>All models are immutable records validated in their constructors, independent of the
 * persistence layer.
 *
 * @see com.phillippitts.podcaster.domain.Podcast
 * @see com.phillippitts.podcaster.domain.Transcript
 */
package com.phillippitts.podcaster.domain;
