/**
 * Authoring-side tooling: signing keys and signed update packages.
 *
 * @since 1.0.0
 */
package com.quorum.tools;
