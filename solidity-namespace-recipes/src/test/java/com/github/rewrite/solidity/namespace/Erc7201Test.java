package com.github.rewrite.solidity.namespace;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class Erc7201Test {

    @Test
    void storageSlotMatchesPublishedExample() {
        assertThat(Erc7201.storageSlot("example.main"))
                .isEqualTo("0x183a6125c38840424c4a85fa12bab2ab606c4b6d0e7cc73c0c06ba5300eab500");
    }

    @Test
    void storageSlotOfOpenZeppelinErc20() {
        assertThat(Erc7201.storageSlot("openzeppelin.storage.ERC20"))
                .isEqualTo("0x52c63247e1f47db19d5ce0460030c497f067ca4cebf71ba98eeadabe20bace00");
    }

    @Test
    void lastByteIsAlwaysCleared() {
        assertThat(Erc7201.storageSlot("box.Box")).hasSize(66).endsWith("00");
        assertThat(Erc7201.storageSlot("box.Box")).isNotEqualTo(Erc7201.storageSlot("box.Box2"));
    }

    @Test
    void storageLocationAnnotation() {
        assertThat(Erc7201.storageLocationAnnotation("box.Box")).isEqualTo("@custom:storage-location erc7201:box.Box");
    }
}
