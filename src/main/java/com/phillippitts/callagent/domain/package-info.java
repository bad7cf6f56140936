/**
 * Domain model for phone calls: sessions, client profiles, conversation turns and audio snippets.
 *
 * <p>Records are immutable value objects. {@link com.phillippitts.callagent.domain.CallSession}
 * is the only mutable type and is confined to its call's serial lane.
 *
 * @since 1.0
 */
package com.phillippitts.callagent.domain;
