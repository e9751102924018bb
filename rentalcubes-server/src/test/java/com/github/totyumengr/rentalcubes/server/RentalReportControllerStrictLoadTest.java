/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.rentalcubes.server;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.junit4.SpringRunner;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

/**
 * @author mengran
 *
 */
@RunWith(SpringRunner.class)
@SpringBootTest(classes = Application.class, properties = {
        "rentalcubes.load-on-startup=false",
        "rentalcubes.data.renting=classpath:orphan/renting.tsv"})
@AutoConfigureMockMvc
public class RentalReportControllerStrictLoadTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @Autowired
    private RentalCubeManager manager;
    
    @Test
    public void testLoadRejectsOrphans() throws Exception {
        
        MvcResult result = mockMvc.perform(MockMvcRequestBuilders.post("/load")).andReturn();
        Assert.assertEquals(422, result.getResponse().getStatus());
        String body = result.getResponse().getContentAsString();
        Assert.assertTrue(body, body.contains("ReferentialIntegrityException"));
        Assert.assertTrue(body, body.contains("Rental 2 references missing customer 99"));
        Assert.assertFalse(manager.isLoaded());
    }
    
}
