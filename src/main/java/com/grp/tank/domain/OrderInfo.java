package com.grp.tank.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderInfo {
    private String orderNo;
    private String projectName;
    private String location;
    private String salesRep;
    private String deliveryDate;
    private String paymentTerms;
    private String portOfDischarge;
}
