package com.eyelevel.invoicetransformer.service.transform;

/**
 * Fixed names and codes of the BASDA commercial invoice produced by {@link InvoiceTransformer}.
 */
public final class TargetSchema {

    public static final String NAMESPACE = "urn:schemas-basda-org:2000:salesInvoice:xdr:3.01";
    public static final String EXTENSION_NAMESPACE = "urn:schemas-bossfed-co-uk:OP-Invoice-v1";
    public static final String EXTENSION_PREFIX = "op";
    public static final String ROOT_ELEMENT = "Invoice";

    public static final String SCHEMA_VERSION = "3.05";
    public static final String LANGUAGE = "en-GB";
    public static final String DECIMAL_SEPARATOR = ".";
    public static final String PRECISION = "20.4";
    public static final String INVOICE_TYPE_CODE = "INV";
    public static final String INVOICE_TYPE_NAME = "Commercial Invoice";

    public static final String SALES_ORDER_REFERENCE_TYPE = "KWOS";
    public static final String ORDER_DATE_TYPE = "ORD";
    public static final String ORDER_DATE_DESC = "Order Date";
    public static final String DELIVERY_DATE_TYPE = "DEL";
    public static final String DELIVERY_DATE_DESC = "Delivery date";

    public static final String SETTLEMENT_FLAG_TYPE = "SETFLG";
    public static final String SETTLEMENT_FLAG_DESC = "Settlement Discount Flag";
    public static final String SETTLEMENT_FLAG_VALUE = "Y";
    public static final String TAX_RATE_CODE = "S";
    public static final String PACK_SIZE = "1";
    public static final String ZERO_AMOUNT_DISCOUNT = "0.00";

    private TargetSchema() {
    }
}
