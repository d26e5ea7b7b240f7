package org.umsforge.codegen.service.impl;

import ca.uhn.fhir.rest.api.server.RequestDetails;
import org.umsforge.codegen.service.MeasureCodeService;

@FunctionalInterface
public interface MeasureCodeServiceFactory {
	MeasureCodeService create(RequestDetails requestDetails);
}
