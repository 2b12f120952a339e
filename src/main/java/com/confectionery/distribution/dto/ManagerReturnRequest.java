package com.confectionery.distribution.dto;

import java.util.List;

/**
 * @param fromReturnBin where the goods are taken from; null means the return bin
 */
public record ManagerReturnRequest(List<ReturnLine> items, Boolean fromReturnBin) {
}
