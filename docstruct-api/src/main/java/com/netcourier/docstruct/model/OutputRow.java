package com.netcourier.docstruct.model;

public record OutputRow(int srNo, String key, String value, String comments, boolean conflict) {
}
