package com.flagship.pharmacy_ledger.document;

import com.flagship.pharmacy_ledger.stock.ExpiredBatchWarning;
import lombok.Value;

import java.util.List;

@Value
public class RecordedSale {
    PosSaleEntity sale;
    List<ExpiredBatchWarning> warnings;
}
