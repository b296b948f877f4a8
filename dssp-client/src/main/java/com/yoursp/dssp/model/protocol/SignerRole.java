package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignerRole {

    @JacksonXmlElementWrapper(localName = "ClaimedRoles", namespace = DsspNamespaces.VR)
    @JacksonXmlProperty(localName = "ClaimedRole", namespace = DsspNamespaces.XADES)
    private List<String> claimedRoles;
}
