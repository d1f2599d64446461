/**
 * Unchecked exception hierarchy rooted at {@link com.phillippitts.podcaster.exception.PodcasterException}.
 */
package com.phillippitts.podcaster.exception;
