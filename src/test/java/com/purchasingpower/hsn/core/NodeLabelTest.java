package com.purchasingpower.hsn.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NodeLabel")
class NodeLabelTest {

    @Test
    @DisplayName("Node ids carry the level prefix")
    void nodeId_prefixesTaxonomyId() {
        assertThat(NodeLabel.CHAPTER.nodeId("40")).isEqualTo("chap_40");
        assertThat(NodeLabel.HEADING.nodeId("4011")).isEqualTo("head_4011");
        assertThat(NodeLabel.SUBHEADING.nodeId("401110")).isEqualTo("sub_401110");
        assertThat(NodeLabel.CODE.nodeId("40111010")).isEqualTo("code_40111010");
    }

    @Test
    @DisplayName("Labels resolve from display name or enum name")
    void fromDisplayName_acceptsBothSpellings() {
        assertThat(NodeLabel.fromDisplayName("HSNCode")).isEqualTo(NodeLabel.CODE);
        assertThat(NodeLabel.fromDisplayName("code")).isEqualTo(NodeLabel.CODE);
        assertThat(NodeLabel.fromDisplayName("subheading")).isEqualTo(NodeLabel.SUBHEADING);
        assertThatThrownBy(() -> NodeLabel.fromDisplayName("Section"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
