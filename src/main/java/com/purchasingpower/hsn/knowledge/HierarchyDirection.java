package com.purchasingpower.hsn.knowledge;

/**
 * Direction of a one-hop hierarchy traversal from a code.
 *
 * @since 1.0.0
 */
public enum HierarchyDirection {
    UP,
    DOWN
}
