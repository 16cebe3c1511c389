/**
 * Threading and identifier helpers shared by the engine components.
 */
package chorus.util;
